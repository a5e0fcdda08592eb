package com.e2eq.docmap.movies;

import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;

/**
 * A geocoded address. Embedded in actors and writers, and stored in {@code places} when
 * referenced as a director's residence. The identifier defaults to the formatted address.
 */
public class Place extends DocumentEntity implements Locatable {

    public static final EntityType<Place> TYPE = EntityType.builder(Place.class, Place::new)
            .collection("places")
            .field("formatted_address", "formattedAddress", String.class)
            .field("geolocation", Point.class)
            .field("street_number", "streetNumber", String.class)
            .field("street_name", "streetName", String.class)
            .field("city", String.class)
            .field("postal_code", "postalCode", String.class)
            .field("county", String.class)
            .field("state", String.class)
            .field("country", String.class)
            .identityFrom("formatted_address")
            .build();

    public Place() {
        super(TYPE);
    }

    @Override
    public String getFormattedAddress() {
        return read("formatted_address");
    }

    public Place setFormattedAddress(String formattedAddress) {
        write("formatted_address", formattedAddress);
        return this;
    }

    @Override
    public Point getGeolocation() {
        return read("geolocation");
    }

    public Place setGeolocation(Point geolocation) {
        write("geolocation", geolocation);
        return this;
    }

    public String getStreetNumber() {
        return read("street_number");
    }

    public Place setStreetNumber(String streetNumber) {
        write("street_number", streetNumber);
        return this;
    }

    public String getStreetName() {
        return read("street_name");
    }

    public Place setStreetName(String streetName) {
        write("street_name", streetName);
        return this;
    }

    public String getCity() {
        return read("city");
    }

    public Place setCity(String city) {
        write("city", city);
        return this;
    }

    public String getPostalCode() {
        return read("postal_code");
    }

    public Place setPostalCode(String postalCode) {
        write("postal_code", postalCode);
        return this;
    }

    public String getCounty() {
        return read("county");
    }

    public Place setCounty(String county) {
        write("county", county);
        return this;
    }

    public String getState() {
        return read("state");
    }

    public Place setState(String state) {
        write("state", state);
        return this;
    }

    public String getCountry() {
        return read("country");
    }

    public Place setCountry(String country) {
        write("country", country);
        return this;
    }
}
