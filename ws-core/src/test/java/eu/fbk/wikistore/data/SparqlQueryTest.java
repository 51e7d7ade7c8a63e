package eu.fbk.wikistore.data;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.wikistore.data.SparqlQuery.Form;

public class SparqlQueryTest {

    @Test
    public void testForms() {
        Assert.assertEquals(Form.SOLUTIONS,
                SparqlQuery.parse("SELECT * WHERE { ?s ?p ?o }").getForm());
        Assert.assertEquals(Form.GRAPH,
                SparqlQuery.parse("CONSTRUCT { ?s ?p ?o } WHERE { ?s ?p ?o }").getForm());
        Assert.assertEquals(Form.GRAPH,
                SparqlQuery.parse("DESCRIBE <http://example.com/s>").getForm());
        Assert.assertEquals(Form.BOOLEAN, SparqlQuery.parse("ASK { ?s ?p ?o }").getForm());
        Assert.assertEquals(Form.SOLUTIONS, SparqlQuery.parse(
                "PREFIX ex: <http://example.com/> SELECT ?s WHERE { ?s ex:p ?o }").getForm());
    }

    @Test
    public void testDataset() {
        final SparqlQuery query = SparqlQuery.parse("SELECT * FROM <http://example.com/g1> "
                + "FROM NAMED <http://example.com/g2> WHERE { ?s ?p ?o }");
        Assert.assertTrue(query.hasDataset());
        Assert.assertEquals(1, query.getDefaultGraphs().size());
        Assert.assertEquals(Iri.parse("http://example.com/g1"), query.getDefaultGraphs().get(0));
        Assert.assertEquals(1, query.getNamedGraphs().size());
        Assert.assertEquals(Iri.parse("http://example.com/g2"), query.getNamedGraphs().get(0));
    }

    @Test
    public void testDatasetOverride() {
        final SparqlQuery query = SparqlQuery.parse("SELECT * WHERE { ?s ?p ?o }");
        Assert.assertFalse(query.hasDataset());
        Assert.assertTrue(query.getDefaultGraphs().isEmpty());
        query.getNamedGraphs().add(Iri.parse("http://example.com/g"));
        Assert.assertTrue(query.hasDataset());
        query.getNamedGraphs().clear();
        Assert.assertFalse(query.hasDataset());
    }

    @Test
    public void testInvalid() {
        for (final String string : new String[] { "", "SELECT WHERE", "foo bar",
                "INSERT DATA { <http://a> <http://b> <http://c> }" }) {
            try {
                SparqlQuery.parse(string);
                Assert.fail("Accepted: " + string);
            } catch (final ParseException ex) {
                Assert.assertEquals(string, ex.getParsedString());
            }
        }
    }

}
