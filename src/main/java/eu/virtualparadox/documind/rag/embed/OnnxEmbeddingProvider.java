package eu.virtualparadox.documind.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.rag.index.DimensionMismatchException;
import eu.virtualparadox.documind.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence-transformer embeddings (all-MiniLM-L6-v2 exported to ONNX) computed in-process.
 * <p>
 * Model and tokenizer are read from {@code <documind.models>/embedding/model.onnx} and
 * {@code tokenizer.json}. Token vectors are mean-pooled over the attention mask and
 * L2-normalised. The ONNX session is thread-safe, so concurrent callers share it.
 */
@Service
public final class OnnxEmbeddingProvider implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingProvider.class);

    private static final int MAX_LEN = 256;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int dimension;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingProvider(final ApplicationConfig config) {
        final Path embeddingModelRoot = config.getModels().resolve("embedding");
        this.modelPath = embeddingModelRoot.resolve("model.onnx");
        this.tokenizerPath = embeddingModelRoot.resolve("tokenizer.json");
        this.dimension = config.getEmbedding().getDimension();
        this.intraOpThreads = config.getEmbedding().getIntraOpThreads();
    }

    /**
     * Loads model and tokenizer. A missing model is logged and leaves the provider unavailable:
     * every call then fails with {@link EmbeddingUnavailableException}.
     */
    @PostConstruct
    public void init() {
        try {
            this.env = OrtEnvironment.getEnvironment();
            final OrtSession.SessionOptions options = OrtInitializer.sessionOptions(intraOpThreads);

            this.session = env.createSession(modelPath.toString(), options);
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

            logger.info("Loaded ONNX embedding model: {}", modelPath);
            logger.info("Model expects inputs: {}", session.getInputNames());
        } catch (final OrtException | IOException | RuntimeException e) {
            logger.error("Unable to load embedding model from {}; embeddings are unavailable", modelPath, e);
            this.session = null;
            this.tokenizer = null;
        }
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (session == null || tokenizer == null) {
            throw new EmbeddingUnavailableException("Embedding model is not loaded: " + modelPath);
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > MAX_LEN) {
                maxLen = MAX_LEN;
            }

            final int batchSize = encodings.size();
            final long[][] inputIdArr = new long[batchSize][maxLen];
            final long[][] attnMaskArr = new long[batchSize][maxLen];
            final long[][] tokenTypeArr = new long[batchSize][maxLen];

            for (int i = 0; i < batchSize; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    return toSentenceVectors((float[][][]) result.get(0).getValue(), attnMaskArr);
                }
            }
        } catch (final EmbeddingUnavailableException | DimensionMismatchException e) {
            throw e;
        } catch (final Exception e) {
            throw new EmbeddingUnavailableException("Failed to embed batch of " + texts.size(), e);
        }
    }

    /**
     * Mean-pools and normalises the token vectors of each text.
     * <p>
     * A model whose hidden size differs from the configured dimension fails with
     * {@link DimensionMismatchException}.
     *
     * @param tokenEmbeddings model output, {@code [batch][tokens][hidden]}
     * @param attentionMask   mask used for the batch, {@code [batch][tokens]}
     * @return one unit vector per text
     */
    List<float[]> toSentenceVectors(final float[][][] tokenEmbeddings, final long[][] attentionMask) {
        final List<float[]> out = new ArrayList<>(tokenEmbeddings.length);
        for (int i = 0; i < tokenEmbeddings.length; i++) {
            final float[] vec = meanPool(tokenEmbeddings[i], attentionMask[i]);
            if (vec.length != dimension) {
                throw new DimensionMismatchException(dimension, vec.length);
            }
            normalize(vec);
            out.add(vec);
        }
        return out;
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
