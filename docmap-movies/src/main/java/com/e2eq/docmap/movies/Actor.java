package com.e2eq.docmap.movies;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.query.Criteria;
import com.e2eq.docmap.query.EntityQuery;
import com.e2eq.docmap.relation.EmbeddedChildren;
import com.e2eq.docmap.relation.EmbeddedOne;

import java.time.LocalDate;
import java.util.List;

public class Actor extends DocumentEntity {

    public static final String PLACE_OF_BIRTH = "place_of_birth";
    static final String BIRTHPLACE_LOCATION = PLACE_OF_BIRTH + ".geolocation";

    public static final EntityType<Actor> TYPE = EntityType.builder(Actor.class, Actor::new)
            .collection("actors")
            .codec(new MeasurementCodec())
            .field("name", String.class)
            .field("birthName", "birth_name", String.class)
            .field("date_of_birth", "dateOfBirth", LocalDate.class)
            .field("height", Measurement.class)
            .field("bio", String.class)
            .embedsOne(PLACE_OF_BIRTH, PLACE_OF_BIRTH, () -> Place.TYPE, true)
            .hasManyEmbedded("roles", () -> Movie.TYPE, "roles")
            .geoIndex(BIRTHPLACE_LOCATION)
            .timestamps()
            .build();

    public Actor() {
        super(TYPE);
    }

    public String getName() {
        return read("name");
    }

    public Actor setName(String name) {
        write("name", name);
        return this;
    }

    public String getBirthName() {
        return read("birth_name");
    }

    public Actor setBirthName(String birthName) {
        write("birth_name", birthName);
        return this;
    }

    public LocalDate getDateOfBirth() {
        return read("date_of_birth");
    }

    public Actor setDateOfBirth(LocalDate dateOfBirth) {
        write("date_of_birth", dateOfBirth);
        return this;
    }

    public Measurement getHeight() {
        return read("height");
    }

    public Actor setHeight(Measurement height) {
        write("height", height);
        return this;
    }

    public String getBio() {
        return read("bio");
    }

    public Actor setBio(String bio) {
        write("bio", bio);
        return this;
    }

    public EmbeddedOne<Place> placeOfBirth() {
        return embedsOne(PLACE_OF_BIRTH);
    }

    private EmbeddedChildren<Movie, MovieRole> castings() {
        return embeddedChildren("roles");
    }

    /**
     * Movies with a role carrying this actor's id.
     */
    public EntityQuery<Movie> movies() {
        return castings().parents();
    }

    /**
     * The roles this actor played, extracted from each movie returned by {@link #movies()}.
     */
    public List<MovieRole> roles() {
        return castings().children();
    }

    /**
     * Actors born within {@code maxMeters} of {@code origin}, nearest first.
     */
    public static EntityQuery<Actor> nearPlaceOfBirth(Datastore datastore, Point origin, double maxMeters) {
        return datastore.find(TYPE)
                .where(Criteria.where(BIRTHPLACE_LOCATION).near(origin).maxDistance(maxMeters));
    }

    public static EntityQuery<Actor> nearPlaceOfBirth(Datastore datastore, Locatable place, double maxMeters) {
        if (place.getGeolocation() == null) {
            throw new IllegalArgumentException("place '" + place.getFormattedAddress() + "' has no geolocation");
        }
        return nearPlaceOfBirth(datastore, place.getGeolocation(), maxMeters);
    }
}
