package eu.virtualparadox.documind.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options for CPU inference.
     *
     * @param intraOpThreads threads per operator; {@code 0} uses all cores but one
     */
    public static OrtSession.SessionOptions sessionOptions(final int intraOpThreads) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            final int threads = intraOpThreads > 0
                    ? intraOpThreads
                    : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(threads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session: intra-op threads {}, inter-op threads 1", threads);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
