package com.fastrelay.autoconfig;

import com.fastrelay.core.failure.RouterFailureClassifier;
import com.fastrelay.core.failure.classifier.*;
import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration
public class FailureClassifierAutoConfiguration {

    // 默认内置一组分类器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(CircuitOpenCaseHandler.class)
    public CircuitOpenCaseHandler circuitOpenCaseHandler() { return new CircuitOpenCaseHandler(); }

    @Bean
    @ConditionalOnMissingBean(PermanentCaseHandler.class)
    public PermanentCaseHandler permanentCaseHandler() { return new PermanentCaseHandler(); }

    @Bean
    @ConditionalOnMissingBean(ClassifiedCaseHandler.class)
    public ClassifiedCaseHandler classifiedCaseHandler() { return new ClassifiedCaseHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutCaseHandler.class)
    public TimeoutCaseHandler timeoutCaseHandler() { return new TimeoutCaseHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownCaseHandler.class)
    public UnknownCaseHandler unknownCaseHandler() { return new UnknownCaseHandler(); }

    // Router 分类器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureClassifier.class)
    public FailureClassifier failureClassifier(ObjectProvider<FailureCaseHandler<?>> handlers) {
        List<FailureCaseHandler<?>> all = handlers.orderedStream().collect(Collectors.toList());
        return new RouterFailureClassifier(all);
    }
}
