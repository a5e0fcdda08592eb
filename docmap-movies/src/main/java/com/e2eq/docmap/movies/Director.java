package com.e2eq.docmap.movies;

import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.query.EntityQuery;
import com.e2eq.docmap.relation.EmbeddedChildren;
import com.e2eq.docmap.relation.ReferencedOne;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public class Director extends DocumentEntity {

    public static final EntityType<Director> TYPE = EntityType.builder(Director.class, Director::new)
            .collection("directors")
            .field("name", String.class)
            .belongsTo("residence", () -> Place.TYPE, "residence_id")
            .hasManyEmbedded("credits", () -> Movie.TYPE, "directors")
            .timestamps()
            .build();

    public Director() {
        super(TYPE);
    }

    @NotBlank
    public String getName() {
        return read("name");
    }

    public Director setName(String name) {
        write("name", name);
        return this;
    }

    public ReferencedOne<Place> residence() {
        return belongsTo("residence");
    }

    private EmbeddedChildren<Movie, DirectorRef> creditSlot() {
        return embeddedChildren("credits");
    }

    /**
     * Movies whose embedded director credits carry this director's id.
     */
    public EntityQuery<Movie> movies() {
        return creditSlot().parents();
    }

    public List<DirectorRef> credits() {
        return creditSlot().children();
    }
}
