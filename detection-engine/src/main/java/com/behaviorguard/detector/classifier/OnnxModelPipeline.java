package com.behaviorguard.detector.classifier;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxJavaType;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trained pipeline exported to ONNX and executed with ONNX Runtime.
 *
 * <p>
 * The graph takes one string tensor of shape {@code [1, T]} holding the
 * document's terms and yields one float tensor of shape {@code [1, classes]}
 * with the class probabilities. Vectorization, feature selection, projection
 * and the classifier itself all live inside the graph. Class names are read
 * from the {@code classes} metadata entry, comma separated, in output order.
 * </p>
 *
 * <p>
 * Terms are extracted the way the training vectorizer does it: lower-cased
 * {@code \w+} runs, so {@code connect:10.0.0.5:443} yields {@code connect},
 * {@code 10}, {@code 0}, {@code 0}, {@code 5} and {@code 443}.
 * </p>
 */
public class OnnxModelPipeline implements ModelPipeline, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxModelPipeline.class);

    static final String CLASSES_METADATA_KEY = "classes";

    private static final Pattern TERM = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;
    private final List<String> classes;

    private OnnxModelPipeline(OrtEnvironment environment, OrtSession session, String inputName,
            List<String> classes) {
        this.environment = environment;
        this.session = session;
        this.inputName = inputName;
        this.classes = List.copyOf(classes);
    }

    /**
     * Create a session over a serialized ONNX model and check that its
     * signature matches a token-sequence classifier.
     *
     * @throws ModelLoadException when the model cannot be parsed or has the wrong shape
     */
    public static OnnxModelPipeline load(byte[] model) {
        OrtEnvironment environment = OrtEnvironment.getEnvironment();
        OrtSession session;
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            session = environment.createSession(model, options);
        } catch (OrtException e) {
            throw new ModelLoadException("Invalid ONNX model: " + e.getMessage(), e);
        }

        try {
            String inputName = checkSignature(session);
            List<String> classes = classesOf(session);
            log.info("ONNX session ready: input '{}', {} classes", inputName, classes.size());
            return new OnnxModelPipeline(environment, session, inputName, classes);
        } catch (ModelLoadException e) {
            closeQuietly(session);
            throw e;
        } catch (OrtException e) {
            closeQuietly(session);
            throw new ModelLoadException("Cannot inspect ONNX model: " + e.getMessage(), e);
        }
    }

    private static String checkSignature(OrtSession session) throws OrtException {
        Map<String, NodeInfo> inputs = session.getInputInfo();
        Map<String, NodeInfo> outputs = session.getOutputInfo();
        if (inputs.size() != 1 || outputs.isEmpty()) {
            throw new ModelLoadException("Expected one input and at least one output, got "
                    + inputs.size() + " and " + outputs.size());
        }
        NodeInfo input = inputs.values().iterator().next();
        if (!(input.getInfo() instanceof TensorInfo tensor) || tensor.type != OnnxJavaType.STRING) {
            throw new ModelLoadException("Model input '" + input.getName() + "' is not a string tensor");
        }
        return input.getName();
    }

    private static List<String> classesOf(OrtSession session) throws OrtException {
        String declared = session.getMetadata().getCustomMetadata().get(CLASSES_METADATA_KEY);
        if (declared == null || declared.isBlank()) {
            throw new ModelLoadException("Model has no '" + CLASSES_METADATA_KEY + "' metadata");
        }
        List<String> classes = new ArrayList<>();
        for (String name : declared.split(",")) {
            if (!name.isBlank()) {
                classes.add(name.trim());
            }
        }

        NodeInfo output = session.getOutputInfo().values().iterator().next();
        if (output.getInfo() instanceof TensorInfo tensor) {
            long[] shape = tensor.getShape();
            long width = shape.length == 0 ? -1 : shape[shape.length - 1];
            if (width > 0 && width != classes.size()) {
                throw new ModelLoadException("Model output " + Arrays.toString(shape) + " does not match "
                        + classes.size() + " declared classes");
            }
        }
        return classes;
    }

    static String[] terms(String document) {
        List<String> terms = new ArrayList<>();
        Matcher matcher = TERM.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            terms.add(matcher.group());
        }
        return terms.toArray(new String[0]);
    }

    @Override
    public List<String> classes() {
        return classes;
    }

    @Override
    public double[] predictProba(String document) {
        if (document == null || document.isBlank()) {
            throw new IllegalArgumentException("Empty document");
        }
        String[] terms = terms(document);
        if (terms.length == 0) {
            throw new IllegalArgumentException("Document has no terms");
        }

        try (OnnxTensor input = OnnxTensor.createTensor(environment, terms, new long[] {1, terms.length});
                OrtSession.Result result = session.run(Map.of(inputName, input))) {
            float[][] output = (float[][]) result.get(0).getValue();
            double[] probabilities = new double[output[0].length];
            for (int i = 0; i < probabilities.length; i++) {
                probabilities[i] = output[0][i];
            }
            return probabilities;
        } catch (OrtException e) {
            throw new IllegalStateException("ONNX inference failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws OrtException {
        session.close();
    }

    private static void closeQuietly(OrtSession session) {
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to release rejected ONNX session: {}", e.getMessage());
        }
    }
}
