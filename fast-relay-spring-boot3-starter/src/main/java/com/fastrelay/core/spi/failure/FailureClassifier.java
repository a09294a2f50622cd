package com.fastrelay.core.spi.failure;

import com.fastrelay.model.enums.FailureKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 失败分类器 按异常类型给出分类
 */
public interface FailureClassifier {

    Classification classify(Throwable t);

    @Getter
    @ToString
    @EqualsAndHashCode
    final class Classification {
        private final FailureKind kind;
        private final String errorClass;

        private Classification(FailureKind kind, String errorClass) {
            this.kind = kind; this.errorClass = errorClass;
        }
        public static Classification of(FailureKind kind, String errorClass) { return new Classification(kind, errorClass); }
        public static Classification transientFailure(String errorClass) { return of(FailureKind.TRANSIENT, errorClass); }
        public static Classification permanent(String errorClass) { return of(FailureKind.PERMANENT, errorClass); }
        public static Classification circuitOpen() { return of(FailureKind.CIRCUIT_OPEN, CIRCUIT_OPEN); }
    }

    String CIRCUIT_OPEN = "circuit_open";
}
