package com.osman.picking.core.code;

import com.google.zxing.EncodeHintType;
import com.google.zxing.MultiFormatWriter;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.osman.picking.config.PipelineConfig.CodeOptions;
import com.osman.picking.core.fs.OutputArtifacts;
import com.osman.picking.core.model.CodeArtifact;
import com.osman.picking.core.model.EncodingFailure;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.logging.AppLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Encodes item codes into code images, one image per distinct code within a run.
 * <p>
 * Instances hold the run's cache and must not be shared between runs.
 */
public class ScannableCodeGenerator {
    private static final Logger LOGGER = AppLogger.get();

    private final CodeOptions options;
    private final OutputArtifacts artifacts;
    private final Map<String, CodeArtifact> generated = new LinkedHashMap<>();
    private final Map<String, EncodingFailure> failed = new LinkedHashMap<>();

    public ScannableCodeGenerator(CodeOptions options, OutputArtifacts artifacts) {
        this.options = Objects.requireNonNull(options, "options");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    /**
     * Attaches the code image of the row's item code, generating it on first use. A code that cannot be
     * encoded flags the row instead; the row is still printed.
     *
     * @throws IOException if the image cannot be written
     */
    public void attach(PickingRow row) throws IOException {
        try {
            row.attachCode(generate(row.itemCode()));
        } catch (EncodingException ex) {
            LOGGER.warning("Row %s: %s".formatted(row.displayNumber(), ex.getMessage()));
            row.markCodeFailure(ex.getMessage());
        }
    }

    /**
     * Returns the artifact for {@code itemCode}, writing the image only the first time the code is seen.
     */
    public CodeArtifact generate(String itemCode) throws EncodingException, IOException {
        CodeArtifact cached = generated.get(itemCode);
        if (cached != null) {
            return cached;
        }
        EncodingFailure previous = failed.get(itemCode);
        if (previous != null) {
            throw new EncodingException(itemCode, previous.message());
        }

        BitMatrix matrix;
        try {
            matrix = encode(itemCode, options);
        } catch (EncodingException ex) {
            failed.put(itemCode, new EncodingFailure(itemCode, ex.getMessage()));
            throw ex;
        }
        String reference = artifacts.codeImageReference(itemCode);
        artifacts.writeCodeImage(reference, toPng(matrix));
        CodeArtifact artifact = new CodeArtifact(itemCode, reference, matrix.getWidth(), matrix.getHeight());
        generated.put(itemCode, artifact);
        LOGGER.fine(() -> "Generated %s for %s".formatted(reference, itemCode));
        return artifact;
    }

    public int artifactCount() {
        return generated.size();
    }

    public List<EncodingFailure> failures() {
        return new ArrayList<>(failed.values());
    }

    /**
     * Encodes without touching any file.
     */
    static BitMatrix encode(String itemCode, CodeOptions options) throws EncodingException {
        validate(itemCode, options);
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, 1);
        int width = options.sizePx();
        int height = options.sizePx();
        if (options.format() == CodeFormat.QR_CODE) {
            hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M);
            hints.put(EncodeHintType.CHARACTER_SET, options.charset());
        } else {
            width = options.sizePx() * 2;
            height = options.sizePx() / 2;
        }
        try {
            return new MultiFormatWriter().encode(itemCode, options.format().barcodeFormat(), width, height, hints);
        } catch (WriterException | IllegalArgumentException ex) {
            throw new EncodingException(itemCode, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), ex);
        }
    }

    static byte[] toPng(BitMatrix matrix) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MatrixToImageWriter.writeToStream(matrix, "PNG", out);
        return out.toByteArray();
    }

    private static void validate(String itemCode, CodeOptions options) throws EncodingException {
        if (itemCode == null || itemCode.isBlank()) {
            throw new EncodingException(String.valueOf(itemCode), "item code is empty");
        }
        for (int i = 0; i < itemCode.length(); i++) {
            if (Character.isISOControl(itemCode.charAt(i))) {
                throw new EncodingException(itemCode, "control character at position " + (i + 1));
            }
        }
        if (options.format() == CodeFormat.QR_CODE) {
            Charset charset;
            try {
                charset = Charset.forName(options.charset());
            } catch (IllegalArgumentException ex) {
                throw new EncodingException(itemCode, "unsupported charset " + options.charset(), ex);
            }
            if (!charset.newEncoder().canEncode(itemCode)) {
                throw new EncodingException(itemCode, "characters outside " + charset.name());
            }
        }
    }
}
