package com.e2eq.docmap.movies;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.mapping.DocumentMapper;
import com.e2eq.docmap.store.memory.InMemoryDocumentStore;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MovieTest {

    private InMemoryDocumentStore store;
    private Datastore datastore;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        datastore = new Datastore(store);
    }

    @Test
    void testAliasedFieldsAreStoredUnderTheirDocumentKeys() {
        Movie movie = new Movie()
                .setTitle("Heat")
                .setSimplePlot("A group of professional bank robbers...")
                .setUrlImdb("http://www.imdb.com/title/tt0113277")
                .setFilmingLocations(List.of("Los Angeles", "Long Beach"))
                .setReleaseDate(LocalDate.of(1995, 12, 15))
                .setRuntime(new Measurement(170, "minutes"));

        Document document = DocumentMapper.instance().toDocument(movie);
        assertEquals("A group of professional bank robbers...", document.get("simplePlot"));
        assertEquals("http://www.imdb.com/title/tt0113277", document.get("urlIMDB"));
        assertEquals(List.of("Los Angeles", "Long Beach"), document.get("filmingLocations"));
        assertFalse(document.containsKey("simple_plot"));
        assertEquals((String) movie.read("simple_plot"), movie.read("simplePlot"));

        datastore.save(movie);
        Movie loaded = datastore.findById(Movie.TYPE, movie.getId()).orElseThrow();
        assertEquals(movie.getSimplePlot(), loaded.getSimplePlot());
        assertEquals(movie.getFilmingLocations(), loaded.getFilmingLocations());
        assertEquals(LocalDate.of(1995, 12, 15), loaded.getReleaseDate());
        assertEquals(new Measurement(170, "minutes"), loaded.getRuntime());
        assertEquals(1, datastore.find(Movie.TYPE).where(new Document("simplePlot", movie.getSimplePlot())).count());
    }

    @Test
    void testMassAssignmentFromFormInput() {
        Movie movie = new Movie();
        movie.assignAttributes(Map.of(
                "title", "Ronin",
                "year", "1998",
                "genres", "Action, Crime , Thriller",
                "filming_locations", "Paris,Nice",
                "runtime", Map.of("amount", "122", "units", "minutes")));
        assertEquals("Ronin", movie.getTitle());
        assertEquals(Integer.valueOf(1998), movie.getYear());
        assertEquals(List.of("Action", "Crime", "Thriller"), movie.getGenres());
        assertEquals(List.of("Paris", "Nice"), movie.getFilmingLocations());
        assertEquals(new Measurement(122, "minutes"), movie.getRuntime());
    }

    @Test
    void testCurrentScope() {
        int year = Year.now().getValue();
        datastore.save(new Movie().setTitle("this year").setYear(year));
        datastore.save(new Movie().setTitle("last year").setYear(year - 1));
        datastore.save(new Movie().setTitle("two years ago").setYear(year - 2));
        datastore.save(new Movie().setTitle("undated"));

        List<String> titles = Movie.current(datastore).stream().map(Movie::getTitle).collect(Collectors.toList());
        assertEquals(List.of("this year", "last year"), titles);
    }

    @Test
    void testSequelIsReferencedFromBothSides() {
        Movie godfather = new Movie().setTitle("The Godfather");
        datastore.save(godfather);
        Movie partTwo = new Movie().setTitle("The Godfather Part II");
        partTwo.sequelTo().assign(godfather);
        datastore.save(partTwo);

        assertEquals(godfather.getId(), store.findOne("movies", new Document("_id", partTwo.getId())).get("sequel_of"));
        Movie loaded = datastore.findById(Movie.TYPE, godfather.getId()).orElseThrow();
        assertEquals("The Godfather Part II", loaded.getSequel().orElseThrow().getTitle());
        assertEquals("The Godfather", datastore.findById(Movie.TYPE, partTwo.getId()).orElseThrow()
                .sequelTo().get().orElseThrow().getTitle());
        assertFalse(partTwo.getSequel().isPresent());
    }

    @Test
    void testDestroyLeavesTheSequelKeyStale() {
        Movie first = new Movie().setTitle("Alien");
        datastore.save(first);
        Movie second = new Movie().setTitle("Aliens");
        second.sequelTo().assign(first);
        datastore.save(second);

        assertTrue(datastore.destroy(first));
        Movie reloaded = datastore.findById(Movie.TYPE, second.getId()).orElseThrow();
        assertEquals(first.getId(), reloaded.sequelTo().getForeignKey());
        assertFalse(reloaded.sequelTo().get().isPresent());
    }

    @Test
    void testDestroyHooksRunAroundRemoval() {
        List<String> events = new ArrayList<>();
        datastore.addPreDestroyHook(Movie.TYPE, entity ->
                events.add("before " + store.count("movies", new Document("_id", entity.getId()))));
        datastore.addPostDestroyHook(Movie.TYPE, entity ->
                events.add("after " + store.count("movies", new Document("_id", entity.getId()))));

        Movie movie = new Movie().setTitle("Thief");
        datastore.save(movie);
        datastore.destroy(movie);
        assertEquals(List.of("before 1", "after 0"), events);

        Movie deleted = new Movie().setTitle("Manhunter");
        datastore.save(deleted);
        datastore.delete(deleted);
        assertEquals(2, events.size());
    }

    @Test
    void testDirectorCreditsAreEmbedded() {
        Director mann = new Director().setName("Michael Mann");
        datastore.save(mann);

        Movie heat = new Movie().setTitle("Heat");
        DirectorRef credit = new DirectorRef().setName(mann.getName());
        credit.director().assign(mann);
        heat.directors().append(credit);
        datastore.save(heat);

        Movie loaded = datastore.findById(Movie.TYPE, heat.getId()).orElseThrow();
        DirectorRef loadedCredit = loaded.directors().find(mann.getId()).orElseThrow();
        assertEquals("Michael Mann", loadedCredit.director().get().orElseThrow().getName());
        assertSame(loaded, loadedCredit.getMovie());

        assertEquals(List.of("Heat"), mann.movies().stream().map(Movie::getTitle).collect(Collectors.toList()));
        assertEquals(1, mann.credits().size());
    }
}
