package eu.virtualparadox.documind.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "documind")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path models;

    private Embedding embedding = new Embedding();
    private Ingest ingest = new Ingest();
    private Retrieval retrieval = new Retrieval();
    private Llm llm = new Llm();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }

    @Getter @Setter
    public static class Embedding {
        /** Vector length of the embedding model; every index entry must match it. */
        private int dimension = 384;
        /** ONNX intra-op threads; 0 uses all cores but one. */
        private int intraOpThreads = 0;
    }

    @Getter @Setter
    public static class Ingest {
        /** Index a zero vector when a chunk cannot be embedded instead of failing the upload. */
        private boolean zeroVectorFallback = true;
        private int embeddingThreads = 4;
    }

    @Getter @Setter
    public static class Retrieval {
        private int defaultMaxResults = 5;
        /** Results must score strictly above this; -1.0 keeps every candidate. */
        private double minSimilarity = -1.0;
    }

    @Getter @Setter
    public static class Llm {
        private Duration timeout = Duration.ofSeconds(60);
        private double temperature = 0.7;
        private int maxTokens = 2000;
        private List<String> stopSequences = new ArrayList<>(List.of("Human:", "Assistant:", "User:", "System:"));
    }
}
