package com.e2eq.docmap.movies;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.query.Criteria;
import com.e2eq.docmap.query.EntityQuery;
import com.e2eq.docmap.relation.CascadePolicy;
import com.e2eq.docmap.relation.EmbeddedMany;
import com.e2eq.docmap.relation.ManyToMany;
import com.e2eq.docmap.relation.ReferencedMany;
import com.e2eq.docmap.relation.ReferencedOne;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Optional;

/**
 * A movie with its cast and director credits embedded, writers linked many-to-many and an
 * optional sequel referenced through {@code sequel_of}.
 */
public class Movie extends DocumentEntity {

    private static final Logger LOG = Logger.getLogger(Movie.class);

    static final String SEQUEL_OF = "sequel_of";

    public static final EntityType<Movie> TYPE = EntityType.builder(Movie.class, Movie::new)
            .collection("movies")
            .codec(new MeasurementCodec())
            .field("title", String.class)
            .field("type", String.class)
            .field("rated", String.class)
            .field("year", Integer.class)
            .field("release_date", "releaseDate", LocalDate.class)
            .field("runtime", Measurement.class)
            .field("votes", Integer.class)
            .field("countries", List.class)
            .field("languages", List.class)
            .field("genres", List.class)
            .field("filmingLocations", "filming_locations", List.class)
            .field("metascore", String.class)
            .field("simplePlot", "simple_plot", String.class)
            .field("plot", String.class)
            .field("urlIMDB", "url_imdb", String.class)
            .field("urlPoster", "url_poster", String.class)
            .field("actors", List.class)
            .embedsMany("roles", () -> MovieRole.TYPE)
            .embedsMany("directors", () -> DirectorRef.TYPE)
            .manyToMany("writers", () -> Writer.TYPE, "writer_ids", "movie_ids")
            .hasOne("sequel", () -> Movie.TYPE, SEQUEL_OF, CascadePolicy.ORPHAN)
            .belongsTo("sequel_to", () -> Movie.TYPE, SEQUEL_OF)
            .timestamps()
            .preDestroy(entity -> LOG.infof("before destroy Movie %s, sequel_to=%s, writers=%s",
                    entity.getId(), entity.rawAttribute(SEQUEL_OF), entity.rawAttribute("writer_ids")))
            .postDestroy(entity -> LOG.infof("after destroy Movie %s, sequel_to=%s, writers=%s",
                    entity.getId(), entity.rawAttribute(SEQUEL_OF), entity.rawAttribute("writer_ids")))
            .build();

    public Movie() {
        super(TYPE);
    }

    public String getTitle() {
        return read("title");
    }

    public Movie setTitle(String title) {
        write("title", title);
        return this;
    }

    public String getType() {
        return read("type");
    }

    public Movie setType(String type) {
        write("type", type);
        return this;
    }

    public String getRated() {
        return read("rated");
    }

    public Movie setRated(String rated) {
        write("rated", rated);
        return this;
    }

    public Integer getYear() {
        return read("year");
    }

    public Movie setYear(Integer year) {
        write("year", year);
        return this;
    }

    public LocalDate getReleaseDate() {
        return read("release_date");
    }

    public Movie setReleaseDate(LocalDate releaseDate) {
        write("release_date", releaseDate);
        return this;
    }

    public Measurement getRuntime() {
        return read("runtime");
    }

    public Movie setRuntime(Measurement runtime) {
        write("runtime", runtime);
        return this;
    }

    public Integer getVotes() {
        return read("votes");
    }

    public Movie setVotes(Integer votes) {
        write("votes", votes);
        return this;
    }

    public List<String> getCountries() {
        return read("countries");
    }

    public Movie setCountries(List<String> countries) {
        write("countries", countries);
        return this;
    }

    public List<String> getLanguages() {
        return read("languages");
    }

    public Movie setLanguages(List<String> languages) {
        write("languages", languages);
        return this;
    }

    public List<String> getGenres() {
        return read("genres");
    }

    public Movie setGenres(List<String> genres) {
        write("genres", genres);
        return this;
    }

    public List<String> getFilmingLocations() {
        return read("filming_locations");
    }

    public Movie setFilmingLocations(List<String> filmingLocations) {
        write("filming_locations", filmingLocations);
        return this;
    }

    public String getMetascore() {
        return read("metascore");
    }

    public Movie setMetascore(String metascore) {
        write("metascore", metascore);
        return this;
    }

    public String getSimplePlot() {
        return read("simple_plot");
    }

    public Movie setSimplePlot(String simplePlot) {
        write("simple_plot", simplePlot);
        return this;
    }

    public String getPlot() {
        return read("plot");
    }

    public Movie setPlot(String plot) {
        write("plot", plot);
        return this;
    }

    public String getUrlImdb() {
        return read("url_imdb");
    }

    public Movie setUrlImdb(String urlImdb) {
        write("url_imdb", urlImdb);
        return this;
    }

    public String getUrlPoster() {
        return read("url_poster");
    }

    public Movie setUrlPoster(String urlPoster) {
        write("url_poster", urlPoster);
        return this;
    }

    public List<String> getActors() {
        return read("actors");
    }

    public Movie setActors(List<String> actors) {
        write("actors", actors);
        return this;
    }

    public EmbeddedMany<MovieRole> roles() {
        return embedsMany("roles");
    }

    public EmbeddedMany<DirectorRef> directors() {
        return embedsMany("directors");
    }

    public ManyToMany<Writer> writers() {
        return manyToMany("writers");
    }

    private ReferencedMany<Movie> sequelSlot() {
        return hasMany("sequel");
    }

    /**
     * The movie whose {@code sequel_of} points at this one.
     */
    public Optional<Movie> getSequel() {
        return sequelSlot().first();
    }

    public ReferencedOne<Movie> sequelTo() {
        return belongsTo("sequel_to");
    }

    /**
     * Movies released within the last two calendar years.
     */
    public static EntityQuery<Movie> current(Datastore datastore) {
        return datastore.find(TYPE).where(Criteria.where("year").gt(Year.now().getValue() - 2));
    }
}
