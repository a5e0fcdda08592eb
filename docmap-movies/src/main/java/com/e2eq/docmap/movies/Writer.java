package com.e2eq.docmap.movies;

import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.relation.EmbeddedOne;
import com.e2eq.docmap.relation.ManyToMany;
import org.jboss.logging.Logger;


public class Writer extends DocumentEntity {

    private static final Logger LOG = Logger.getLogger(Writer.class);

    public static final EntityType<Writer> TYPE = EntityType.builder(Writer.class, Writer::new)
            .collection("writers")
            .field("name", String.class)
            .embedsOne("hometown", "hometown", () -> Place.TYPE, true)
            .manyToMany("movies", () -> Movie.TYPE, "movie_ids", "writer_ids")
            .timestamps()
            .preDestroy(entity -> LOG.infof("before destroy Writer %s, movies=%s",
                    entity.getId(), entity.rawAttribute("movie_ids")))
            .postDestroy(entity -> LOG.infof("after destroy Writer %s, movies=%s",
                    entity.getId(), entity.rawAttribute("movie_ids")))
            .build();

    public Writer() {
        super(TYPE);
    }

    public String getName() {
        return read("name");
    }

    public Writer setName(String name) {
        write("name", name);
        return this;
    }

    public EmbeddedOne<Place> hometown() {
        return embedsOne("hometown");
    }

    public ManyToMany<Movie> movies() {
        return manyToMany("movies");
    }
}
