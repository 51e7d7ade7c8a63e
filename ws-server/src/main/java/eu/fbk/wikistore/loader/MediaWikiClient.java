package eu.fbk.wikistore.loader;

import java.io.Closeable;
import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.openrdf.model.Statement;

/**
 * Access to the MediaWiki API and to the entity data endpoint of a Wikibase instance.
 * <p>
 * Page enumeration methods return one page of results at a time, together with the continuation
 * parameters (the {@code continue} object of the MediaWiki API) to pass to the next call; a null
 * continuation marks the last page.
 * </p>
 */
public interface MediaWikiClient extends Closeable {

    /**
     * Lists the pages in a namespace ({@code allpages}). When a slot is given, only the pages
     * whose latest revision has content in that slot are returned.
     *
     * @param namespace
     *            the namespace id
     * @param slot
     *            the revision slot pages must have, e.g. {@code mediainfo}; null for no filter
     * @param continuation
     *            the continuation parameters returned by the previous call, null for the first
     *            call
     * @return one page of results
     * @throws IOException
     *             on failure
     */
    Batch listPages(int namespace, @Nullable String slot,
            @Nullable Map<String, String> continuation) throws IOException;

    /**
     * Lists the changes newer than the given timestamp, in chronological order
     * ({@code list=recentchanges}). Changes are restricted to the given slot if not null, to the
     * given namespaces otherwise.
     *
     * @param since
     *            the start timestamp, inclusive
     * @param namespaces
     *            the namespace ids, ignored if a slot is given
     * @param slot
     *            the revision slot changes must touch, null for no slot filter
     * @param continuation
     *            the continuation parameters returned by the previous call, null for the first
     *            call
     * @return one page of results
     * @throws IOException
     *             on failure
     */
    Batch listChanges(Date since, List<Integer> namespaces, @Nullable String slot,
            @Nullable Map<String, String> continuation) throws IOException;

    /**
     * Fetches the RDF description of an entity, in its full ({@code dump}) flavor.
     *
     * @param entityId
     *            the entity id, e.g. {@code Q42}
     * @return the entity statements, without context, or null if the entity does not exist
     * @throws IOException
     *             on failure
     */
    @Nullable
    List<Statement> fetchEntity(String entityId) throws IOException;

    @Override
    void close();

    /**
     * A page of a MediaWiki list result.
     */
    final class Batch {

        private final List<Page> pages;

        @Nullable
        private final Map<String, String> continuation;

        public Batch(final List<Page> pages, @Nullable final Map<String, String> continuation) {
            this.pages = ImmutableList.copyOf(pages);
            this.continuation = continuation == null ? null : ImmutableMap.copyOf(continuation);
        }

        public List<Page> getPages() {
            return this.pages;
        }

        @Nullable
        public Map<String, String> getContinuation() {
            return this.continuation;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("pages", this.pages.size())
                    .add("continuation", this.continuation).toString();
        }

    }

    /**
     * A wiki page, possibly with the timestamp of a change to it.
     */
    final class Page {

        private final String title;

        private final long pageId;

        @Nullable
        private final Date timestamp;

        public Page(final String title, final long pageId, @Nullable final Date timestamp) {
            this.title = Preconditions.checkNotNull(title);
            this.pageId = pageId;
            this.timestamp = timestamp;
        }

        public String getTitle() {
            return this.title;
        }

        public long getPageId() {
            return this.pageId;
        }

        @Nullable
        public Date getTimestamp() {
            return this.timestamp;
        }

        @Override
        public String toString() {
            return this.title + " (" + this.pageId + ")";
        }

    }

}
