package com.e2eq.docmap.movies;

import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.relation.ReferencedOne;

/**
 * A director credit embedded in {@link Movie}, identified by the director's id.
 */
public class DirectorRef extends DocumentEntity {

    public static final EntityType<DirectorRef> TYPE = EntityType.builder(DirectorRef.class, DirectorRef::new)
            .field("name", String.class)
            .belongsTo("director", () -> Director.TYPE, ID)
            .build();

    public DirectorRef() {
        super(TYPE);
    }

    public String getName() {
        return read("name");
    }

    public DirectorRef setName(String name) {
        write("name", name);
        return this;
    }

    public ReferencedOne<Director> director() {
        return belongsTo("director");
    }

    public Movie getMovie() {
        return (Movie) getEmbeddedParent();
    }
}
