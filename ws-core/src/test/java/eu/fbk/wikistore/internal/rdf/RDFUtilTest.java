package eu.fbk.wikistore.internal.rdf;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.impl.BNodeImpl;
import org.openrdf.model.impl.LiteralImpl;
import org.openrdf.model.impl.StatementImpl;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.XMLSchema;

public class RDFUtilTest {

    @Test
    public void testEscape() {
        Assert.assertEquals("a\\tb", RDFUtil.escape("a\tb"));
        Assert.assertEquals("\\t\\b\\n\\r\\f\\\\\\'\\\"",
                RDFUtil.escape("\t\b\n\r\f\\'\""));
        Assert.assertEquals("say \\\"hi\\\"\\n", RDFUtil.escape("say \"hi\"\n"));
    }

    @Test
    public void testEscapeUnchanged() {
        final String plain = "plain text";
        Assert.assertSame(plain, RDFUtil.escape(plain));
        Assert.assertEquals("", RDFUtil.escape(""));
        final String unicode = "café € 😀";
        Assert.assertEquals(unicode, RDFUtil.escape(unicode));
    }

    @Test
    public void testToString() {
        Assert.assertEquals("<http://example.com/s>",
                RDFUtil.toString(new URIImpl("http://example.com/s")));
        Assert.assertEquals("_:b1", RDFUtil.toString(new BNodeImpl("b1")));
        Assert.assertEquals("\"a\\\"b\"@en", RDFUtil.toString(new LiteralImpl("a\"b", "en")));
        Assert.assertEquals("\"1\"^^<http://www.w3.org/2001/XMLSchema#integer>",
                RDFUtil.toString(new LiteralImpl("1", XMLSchema.INTEGER)));
        Assert.assertEquals("<http://example.com/s> <http://example.com/p> "
                + "<http://example.com/o> .", RDFUtil.toString(new StatementImpl(new URIImpl(
                "http://example.com/s"), new URIImpl("http://example.com/p"), new URIImpl(
                "http://example.com/o"))));
    }

}
