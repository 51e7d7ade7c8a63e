package eu.fbk.wikistore.triplestore;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

public class LoggingTripleStoreTest {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private static final URI GRAPH = FACTORY.createURI("http://example.com/graph");

    private Logger logger;

    private Level level;

    private ListAppender<ILoggingEvent> appender;

    private TripleStore store;

    @Before
    public void setUp() throws Throwable {
        this.logger = (Logger) LoggerFactory.getLogger(LoggingTripleStore.class);
        this.level = this.logger.getLevel();
        this.appender = new ListAppender<ILoggingEvent>();
        this.appender.start();
        this.logger.addAppender(this.appender);
        this.logger.setLevel(Level.TRACE);
        this.store = new LoggingTripleStore(RepositoryTripleStore.newMemoryStore());
        this.store.init();
    }

    @After
    public void tearDown() {
        this.store.close();
        this.logger.detachAppender(this.appender);
        this.logger.setLevel(this.level);
    }

    @Test
    public void testStatementsTraced() throws Throwable {
        final Statement statement = FACTORY.createStatement(
                FACTORY.createURI("http://example.com/s"),
                FACTORY.createURI("http://example.com/p"), FACTORY.createLiteral("o", "en"),
                GRAPH);
        final TripleTransaction tx = this.store.begin(false);
        tx.add(ImmutableList.of(statement));
        tx.remove(ImmutableList.of(statement));
        tx.get(null, FACTORY.createURI("http://example.com/p"), null, null).close();
        tx.end(true);

        final List<String> messages = Lists.newArrayList();
        for (final ILoggingEvent event : this.appender.list) {
            messages.add(event.getFormattedMessage());
        }
        final String name = tx.toString();
        Assert.assertTrue(messages.toString(), messages.contains(name
                + " + <http://example.com/s> <http://example.com/p> \"o\"@en "
                + "<http://example.com/graph> ."));
        Assert.assertTrue(messages.toString(), messages.contains(name
                + " - <http://example.com/s> <http://example.com/p> \"o\"@en "
                + "<http://example.com/graph> ."));
        Assert.assertTrue(messages.toString(), messages.contains(name
                + " get ? <http://example.com/p> ? ?"));
        Assert.assertTrue(messages.get(messages.size() - 1).startsWith(
                name + " committed in "));
        Assert.assertTrue(messages.get(messages.size() - 1).endsWith(
                "+1 -1 statements, 0 graphs cleared"));
    }

}
