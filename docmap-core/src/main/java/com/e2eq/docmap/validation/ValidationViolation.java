package com.e2eq.docmap.validation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One failed constraint. {@code field} is the bean path of the property, for example
 * {@code name} or {@code placeOfBirth.city}; {@code message} is the interpolated constraint message.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class ValidationViolation {
    protected String field;
    protected String message;
    protected Object invalidValue;

    public ValidationViolation(String field, String message) {
        this.field = field;
        this.message = message;
    }
}
