package com.e2eq.docmap.movies;

import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.relation.ReferencedOne;

/**
 * A part played in a movie, embedded in {@link Movie}. The role's identifier is the id of the
 * actor playing it.
 */
public class MovieRole extends DocumentEntity {

    public static final EntityType<MovieRole> TYPE = EntityType.builder(MovieRole.class, MovieRole::new)
            .field("character", String.class)
            .field("actorName", "actor_name", String.class)
            .field("main", Boolean.class)
            .field("urlCharacter", "url_character", String.class)
            .field("urlPhoto", "url_photo", String.class)
            .field("urlProfile", "url_profile", String.class)
            .belongsTo("actor", () -> Actor.TYPE, ID)
            .build();

    public MovieRole() {
        super(TYPE);
    }

    public String getCharacter() {
        return read("character");
    }

    public MovieRole setCharacter(String character) {
        write("character", character);
        return this;
    }

    public String getActorName() {
        return read("actor_name");
    }

    public MovieRole setActorName(String actorName) {
        write("actor_name", actorName);
        return this;
    }

    public Boolean getMain() {
        return read("main");
    }

    public MovieRole setMain(Boolean main) {
        write("main", main);
        return this;
    }

    public String getUrlCharacter() {
        return read("url_character");
    }

    public MovieRole setUrlCharacter(String urlCharacter) {
        write("url_character", urlCharacter);
        return this;
    }

    public String getUrlPhoto() {
        return read("url_photo");
    }

    public MovieRole setUrlPhoto(String urlPhoto) {
        write("url_photo", urlPhoto);
        return this;
    }

    public String getUrlProfile() {
        return read("url_profile");
    }

    public MovieRole setUrlProfile(String urlProfile) {
        write("url_profile", urlProfile);
        return this;
    }

    public ReferencedOne<Actor> actor() {
        return belongsTo("actor");
    }

    public Movie getMovie() {
        return (Movie) getEmbeddedParent();
    }
}
