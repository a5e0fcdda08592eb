package com.e2eq.docmap.movies;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.bson.Document;

/**
 * A quantity with optional units, such as an actor's height or a movie's runtime.
 * Amounts given in meters are converted to feet when the value is constructed, so stored
 * values are always in feet or unitless.
 */
@Getter
@EqualsAndHashCode
public final class Measurement {

    public static final String METERS = "meters";
    public static final String FEET = "feet";
    static final double METERS_PER_FOOT = 0.3048;

    private final Double amount;
    private final String units;

    public Measurement(Number amount) {
        this(amount, null);
    }

    public Measurement(Number amount, String units) {
        if (amount == null) {
            throw new IllegalArgumentException("a measurement requires an amount");
        }
        String normalizedUnits = units == null || units.isBlank() ? null : units.trim();
        if (METERS.equals(normalizedUnits)) {
            this.amount = amount.doubleValue() / METERS_PER_FOOT;
            this.units = FEET;
        } else {
            this.amount = amount.doubleValue();
            this.units = normalizedUnits;
        }
    }

    public boolean hasUnits() {
        return units != null;
    }

    /**
     * The stored form: {@code {amount, units}}, or {@code {amount}} for a unitless value.
     */
    public Document toDocument() {
        Document document = new Document("amount", amount);
        if (units != null) {
            document.append("units", units);
        }
        return document;
    }

    @Override
    public String toString() {
        return units != null ? amount + " (" + units + ")" : String.valueOf(amount);
    }
}
