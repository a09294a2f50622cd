package com.fastrelay.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标注在配置类上, 随容器启动消费 worker
 * 等价于 relay.workers.enabled=true; handler 非空时等价于 relay.workers.handler
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableRelayWorkers {

    boolean value() default true;

    /** 使用的 MessageHandler bean 名称, 为空时取唯一的 MessageHandler */
    String handler() default "";
}
