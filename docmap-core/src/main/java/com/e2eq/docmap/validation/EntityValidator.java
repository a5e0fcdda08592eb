package com.e2eq.docmap.validation;

import com.e2eq.docmap.mapping.DocumentEntity;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Runs Jakarta Bean Validation over an entity and converts each {@link ConstraintViolation}
 * into a {@link ValidationViolation}. Constraints are declared on the entity's getters since
 * attribute values live in the entity's document rather than in fields.
 */
public class EntityValidator {
    private static final Logger LOG = Logger.getLogger(EntityValidator.class);

    private final Validator validator;

    public EntityValidator() {
        this(buildDefaultFactory().getValidator());
    }

    public EntityValidator(Validator validator) {
        this.validator = validator;
    }

    private static ValidatorFactory buildDefaultFactory() {
        // the parameter interpolator avoids a runtime dependency on an EL implementation
        return Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    public List<ValidationViolation> validate(DocumentEntity entity) {
        Set<ConstraintViolation<DocumentEntity>> violationSet = validator.validate(entity);
        if (violationSet.isEmpty()) {
            return List.of();
        }
        List<ValidationViolation> violations = new ArrayList<>(violationSet.size());
        for (ConstraintViolation<DocumentEntity> constraintViolation : violationSet) {
            violations.add(new ValidationViolation(
                    constraintViolation.getPropertyPath().toString(),
                    constraintViolation.getMessage(),
                    constraintViolation.getInvalidValue()));
        }
        violations.sort(Comparator.comparing(ValidationViolation::getField));
        if (LOG.isDebugEnabled()) {
            LOG.debugf("%s failed validation: %s", entity.getEntityType().getName(), violations);
        }
        return violations;
    }
}
