package pl.marcinmilkowski.word_diff.graph;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.MMapDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes definitions into a Lucene index readable by {@link LuceneDefinitionGraph}.
 *
 * One document per term: the term is indexed as an exact {@link StringField},
 * the definition tokens are stored, in order, as a multi-valued stored field.
 */
public class DefinitionIndexer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionIndexer.class);

    static final String FIELD_TERM = "term";
    static final String FIELD_TOKEN = "token";

    private final Directory directory;
    private final IndexWriter writer;

    public DefinitionIndexer(Path indexPath) throws IOException {
        Files.createDirectories(indexPath);
        this.directory = MMapDirectory.open(indexPath);

        IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        config.setRAMBufferSizeMB(64.0);
        this.writer = new IndexWriter(directory, config);
        logger.info("Definition indexer opened at {}", indexPath);
    }

    /**
     * Add one definition. The term is expected to be normalized already.
     */
    public void addDefinition(String term, List<String> tokens) throws IOException {
        Document doc = new Document();
        doc.add(new StringField(FIELD_TERM, term, Field.Store.YES));
        for (String token : tokens) {
            doc.add(new StoredField(FIELD_TOKEN, token));
        }
        writer.addDocument(doc);
    }

    /**
     * Index every definition of a graph and commit.
     *
     * @return number of documents in the index
     */
    public long indexGraph(MapDefinitionGraph graph) throws IOException {
        long count = 0;
        for (Map.Entry<String, List<String>> entry : graph.definitions().entrySet()) {
            addDefinition(entry.getKey(), entry.getValue());
            count++;
            if (count % 100000 == 0) {
                logger.info("Indexed {} definitions...", count);
            }
        }
        commit();
        return getDocumentCount();
    }

    public void commit() throws IOException {
        writer.commit();
        logger.info("Definition index committed.");
    }

    public long getDocumentCount() {
        return writer.getDocStats().numDocs;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        directory.close();
        logger.info("Definition indexer closed.");
    }
}
