package com.plantops.qms.lifecycle.core.util;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Shared Jakarta Validation entry point for engine inputs.
 */
public final class QmsBeanValidation {

    private QmsBeanValidation() {
    }

    private static final class SingletonHelper {
        private static final ValidatorFactory VALIDATOR_FACTORY = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    /**
     * Validates the bean and returns one "path: message" line per violation, sorted.
     */
    public static List<String> violationsOf(Object bean) {
        Set<ConstraintViolation<Object>> violations = SingletonHelper.VALIDATOR_FACTORY.getValidator().validate(bean);
        return violations.stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .sorted(Comparator.naturalOrder())
                .toList();
    }
}
