package ch.so.arp.rag.hybrid;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the store, the pipeline feature toggles, admission control and
 * ingestion.
 */
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    /**
     * Use deterministic offline collaborators instead of the OpenAI API.
     */
    private boolean mockOpenai = true;

    private final Store store = new Store();

    private final Features features = new Features();

    private final Admission admission = new Admission();

    private final Embedding embedding = new Embedding();

    private final Ingest ingest = new Ingest();

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public Store getStore() {
        return store;
    }

    public Features getFeatures() {
        return features;
    }

    public Admission getAdmission() {
        return admission;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public static class Store {

        /**
         * Location of the vector index snapshot.
         */
        private String indexPath = "data/vector.index";

        public String getIndexPath() {
            return indexPath;
        }

        public void setIndexPath(String indexPath) {
            this.indexPath = indexPath;
        }
    }

    /**
     * Defaults for the optional pipeline stages. Requests may override planning,
     * tools and follow-ups.
     */
    public static class Features {

        private boolean planning = false;

        private boolean tools = true;

        private boolean docActions = true;

        private boolean followups = true;

        public boolean isPlanning() {
            return planning;
        }

        public void setPlanning(boolean planning) {
            this.planning = planning;
        }

        public boolean isTools() {
            return tools;
        }

        public void setTools(boolean tools) {
            this.tools = tools;
        }

        public boolean isDocActions() {
            return docActions;
        }

        public void setDocActions(boolean docActions) {
            this.docActions = docActions;
        }

        public boolean isFollowups() {
            return followups;
        }

        public void setFollowups(boolean followups) {
            this.followups = followups;
        }
    }

    public static class Admission {

        private int queryLimit = 10;

        private Duration queryWindow = Duration.ofHours(1);

        private int ingestLimit = 1;

        private Duration ingestWindow = Duration.ofHours(1);

        public int getQueryLimit() {
            return queryLimit;
        }

        public void setQueryLimit(int queryLimit) {
            this.queryLimit = queryLimit;
        }

        public Duration getQueryWindow() {
            return queryWindow;
        }

        public void setQueryWindow(Duration queryWindow) {
            this.queryWindow = queryWindow;
        }

        public int getIngestLimit() {
            return ingestLimit;
        }

        public void setIngestLimit(int ingestLimit) {
            this.ingestLimit = ingestLimit;
        }

        public Duration getIngestWindow() {
            return ingestWindow;
        }

        public void setIngestWindow(Duration ingestWindow) {
            this.ingestWindow = ingestWindow;
        }
    }

    public static class Embedding {

        /**
         * Vector length of the deterministic embedder.
         */
        private int dimensions = 384;

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class Ingest {

        private int chunkSize = 800;

        private int chunkOverlap = 100;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }
    }
}
