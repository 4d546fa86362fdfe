package pl.marcinmilkowski.word_diff.graph;

import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Definition graph backed by a Lucene index written by {@link DefinitionIndexer}.
 *
 * <p>The index is opened read-only; {@link IndexSearcher} is thread-safe, so a
 * single instance serves all concurrent runs. Looked-up definitions are memoized.</p>
 *
 * <p>Lookup I/O failures surface as {@link UncheckedIOException}.</p>
 */
public class LuceneDefinitionGraph implements DefinitionGraph, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LuceneDefinitionGraph.class);

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final ConcurrentHashMap<String, List<String>> cache = new ConcurrentHashMap<>();

    public LuceneDefinitionGraph(Path indexPath) throws IOException {
        this.directory = FSDirectory.open(indexPath);
        this.reader = DirectoryReader.open(directory);
        this.searcher = new IndexSearcher(reader);
        logger.info("Opened definition index {} ({} terms)", indexPath, reader.numDocs());
    }

    @Override
    public List<String> expand(String term) {
        List<String> tokens = cache.computeIfAbsent(term, this::lookup);
        return tokens.isEmpty() ? List.of(term) : tokens;
    }

    @Override
    public boolean contains(String term) {
        return !cache.computeIfAbsent(term, this::lookup).isEmpty();
    }

    @Override
    public int size() {
        return reader.numDocs();
    }

    private List<String> lookup(String term) {
        try {
            TopDocs hits = searcher.search(new TermQuery(new Term(DefinitionIndexer.FIELD_TERM, term)), 1);
            if (hits.scoreDocs.length == 0) {
                return List.of();
            }
            Document doc = searcher.storedFields().document(hits.scoreDocs[0].doc);
            return List.copyOf(Arrays.asList(doc.getValues(DefinitionIndexer.FIELD_TOKEN)));
        } catch (IOException e) {
            throw new UncheckedIOException("Definition lookup failed for '" + term + "'", e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
        directory.close();
    }

    @Override
    public String toString() {
        return String.format("LuceneDefinitionGraph[%d terms]", reader.numDocs());
    }
}
