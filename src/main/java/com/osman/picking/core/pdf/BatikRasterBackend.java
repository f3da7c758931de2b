package com.osman.picking.core.pdf;

import com.osman.picking.logging.AppLogger;
import org.apache.batik.transcoder.TranscoderException;
import org.apache.batik.transcoder.TranscoderInput;
import org.apache.batik.transcoder.TranscoderOutput;
import org.apache.batik.transcoder.image.ImageTranscoder;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * In-process renderer: every inline SVG sheet of the markup is transcoded by Batik into a raster at print
 * resolution, and PDFBox places each raster on a page of the sheet's physical size.
 * <p>
 * Text is drawn with the registered font folder first, then the platform's sans-serif font. A sheet holding
 * characters none of them can show fails the render instead of printing placeholder glyphs.
 */
public final class BatikRasterBackend implements RenderBackend {
    public static final String NAME = "batik";

    private static final String SVG_NS = "http://www.w3.org/2000/svg";
    private static final String XLINK_NS = "http://www.w3.org/1999/xlink";

    private static final float MM_PER_INCH = 25.4f;
    private static final float POINTS_PER_INCH = 72f;
    private static final Logger LOGGER = AppLogger.get();

    private final Path fontDirectory;
    private final int dpi;

    /**
     * @param fontDirectory folder of font files to register, or {@code null} for platform fonts only
     * @param dpi           raster resolution
     */
    public BatikRasterBackend(Path fontDirectory, int dpi) {
        if (dpi < 72) {
            throw new IllegalArgumentException("dpi below 72: " + dpi);
        }
        this.fontDirectory = fontDirectory;
        this.dpi = dpi;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return fontDirectory == null || Files.isDirectory(fontDirectory);
    }

    @Override
    public void render(Path markup, Path target) throws IOException {
        Document dom = parse(markup);
        List<Element> sheets = sheets(dom);
        if (sheets.isEmpty()) {
            throw new IOException("Markup contains no page: " + markup);
        }
        // Batik reads the installed families once per JVM, so the folder is registered before any transcode
        SheetFonts fonts = fontDirectory == null ? SheetFonts.system() : SheetFonts.load(fontDirectory);
        Path baseDir = markup.toAbsolutePath().getParent();
        String baseUri = markup.toAbsolutePath().toUri().toString();

        try (PDDocument document = new PDDocument()) {
            for (Element sheet : sheets) {
                prepare(sheet, fonts, baseDir);
                BufferedImage raster = transcode(serialize(sheet), baseUri);
                addPage(document, raster);
            }
            document.save(target.toFile());
        }
        LOGGER.fine(() -> "Rendered %d sheets at %d dpi to %s".formatted(sheets.size(), dpi, target));
    }

    private static Document parse(Path markup) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            try (InputStream in = Files.newInputStream(markup)) {
                return factory.newDocumentBuilder().parse(in);
            }
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Unreadable markup " + markup + ": " + e.getMessage(), e);
        }
    }

    private static List<Element> sheets(Document dom) {
        List<Element> sheets = new ArrayList<>();
        NodeList svgs = dom.getElementsByTagNameNS(SVG_NS, "svg");
        for (int i = 0; i < svgs.getLength(); i++) {
            Element svg = (Element) svgs.item(i);
            if (svg.getParentNode() == null || !SVG_NS.equals(svg.getParentNode().getNamespaceURI())) {
                sheets.add(svg);
            }
        }
        return sheets;
    }

    /**
     * Checks that every text can be shown and every image exists, and puts the registered families first.
     */
    private static void prepare(Element sheet, SheetFonts fonts, Path baseDir) throws IOException {
        NodeList texts = sheet.getElementsByTagNameNS(SVG_NS, "text");
        for (int i = 0; i < texts.getLength(); i++) {
            Element text = (Element) texts.item(i);
            String missing = fonts.undisplayable(text.getTextContent());
            if (!missing.isEmpty()) {
                throw new IOException("No available font can display '" + missing + "'");
            }
            text.setAttribute("font-family", fonts.familyList(text.getAttribute("font-family")));
        }
        NodeList images = sheet.getElementsByTagNameNS(SVG_NS, "image");
        for (int i = 0; i < images.getLength(); i++) {
            Element image = (Element) images.item(i);
            String href = image.getAttributeNS(XLINK_NS, "href");
            if (!href.isEmpty() && !Files.isRegularFile(baseDir.resolve(href).normalize())) {
                throw new IOException("Image not found: " + href);
            }
        }
    }

    private static String serialize(Element sheet) throws IOException {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(sheet), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IOException("Cannot extract sheet: " + e.getMessage(), e);
        }
    }

    private BufferedImage transcode(String svgContent, String baseUri) throws IOException {
        SheetTranscoder transcoder = new SheetTranscoder();
        transcoder.addTranscodingHint(ImageTranscoder.KEY_PIXEL_UNIT_TO_MILLIMETER, MM_PER_INCH / dpi);
        transcoder.addTranscodingHint(ImageTranscoder.KEY_BACKGROUND_COLOR, Color.WHITE);
        transcoder.addTranscodingHint(ImageTranscoder.KEY_ALLOW_EXTERNAL_RESOURCES, true);

        TranscoderInput input = new TranscoderInput(new StringReader(svgContent));
        input.setURI(baseUri);
        try {
            transcoder.transcode(input, (TranscoderOutput) null);
        } catch (TranscoderException e) {
            throw new IOException("Batik could not render sheet: " + e.getMessage(), e);
        }
        return transcoder.getBufferedImage();
    }

    private void addPage(PDDocument document, BufferedImage raster) throws IOException {
        float widthPt = raster.getWidth() * POINTS_PER_INCH / dpi;
        float heightPt = raster.getHeight() * POINTS_PER_INCH / dpi;
        PDPage page = new PDPage(new PDRectangle(widthPt, heightPt));
        document.addPage(page);
        PDImageXObject picture = LosslessFactory.createFromImage(document, raster);
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
            stream.drawImage(picture, 0, 0, widthPt, heightPt);
        }
    }

    private static final class SheetTranscoder extends ImageTranscoder {
        private BufferedImage image;

        @Override
        public BufferedImage createImage(int w, int h) {
            return new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        }

        @Override
        public void writeImage(BufferedImage img, TranscoderOutput out) {
            this.image = img;
        }

        BufferedImage getBufferedImage() {
            if (image == null) {
                throw new IllegalStateException("No image produced during SVG transcoding");
            }
            return image;
        }
    }
}
