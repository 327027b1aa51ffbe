package com.techlab.mailmerge.renderer;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.techlab.mailmerge.model.Assets;
import com.techlab.mailmerge.model.RenderRequest;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders composed HTML to A4 PDF with OpenHTMLToPDF.
 *
 * <p>Each call builds its own parser and renderer, so concurrent calls share nothing but the
 * immutable stylesheet and font settings.
 */
@Slf4j
@Component
public class HtmlDocumentRenderer implements DocumentRenderer {

    private static final Pattern DATA_URI = Pattern.compile("^data:([\\w.+-]+/[\\w.+-]+)?(;[^,]*)?;base64,(.*)$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DocumentComposer composer;
    private final File fontFile;
    private final String fontFamily;

    public HtmlDocumentRenderer(DocumentComposer composer,
                                @Value("${mailmerge.render.font-path:}") String fontPath,
                                @Value("${mailmerge.render.font-family:Marianne}") String fontFamily) {
        this.composer = composer;
        this.fontFamily = fontFamily;
        this.fontFile = resolveFont(fontPath);
    }

    @Override
    public byte[] render(RenderRequest request) throws RenderException {
        Assets assets = request.getAssets() != null ? request.getAssets() : Assets.NONE;
        checkDataUri(Assets.LOGO, assets.getLogo());
        checkDataUri(Assets.SIGNATURE, assets.getSignature());

        String html = composer.compose(request);
        org.w3c.dom.Document document;
        try {
            document = new W3CDom().fromJsoup(Jsoup.parse(html));
        } catch (RuntimeException e) {
            throw new InvalidMarkupException("Template markup could not be parsed: " + e.getMessage(), e);
        }

        ByteArrayOutputStream pdfOutputStream = new ByteArrayOutputStream(Math.max(html.length(), 8192));
        try {
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.useFastMode();
            builder.withW3cDocument(document, null);
            if (fontFile != null) {
                builder.useFont(fontFile, fontFamily);
            }
            builder.toStream(pdfOutputStream);
            builder.run();
        } catch (IOException | RuntimeException e) {
            throw new InvalidMarkupException("Document layout failed for " + request.outputFilename() + ": " + e.getMessage(), e);
        }

        byte[] pdfBytes = pdfOutputStream.toByteArray();
        log.debug("Rendered {}: {} bytes", request.outputFilename(), pdfBytes.length);
        return pdfBytes;
    }

    static void checkDataUri(String assetName, String value) throws AssetDecodeException {
        if (value == null || value.isBlank()) {
            return;
        }
        Matcher matcher = DATA_URI.matcher(value.strip());
        if (!matcher.matches()) {
            throw new AssetDecodeException("The " + assetName + " is not a base64 data URI");
        }
        try {
            Base64.getDecoder().decode(WHITESPACE.matcher(matcher.group(3)).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new AssetDecodeException("The " + assetName + " could not be decoded: " + e.getMessage(), e);
        }
    }

    private static File resolveFont(String fontPath) {
        if (fontPath == null || fontPath.isBlank()) {
            return null;
        }
        File file = new File(fontPath);
        if (!file.isFile()) {
            log.warn("Font file not found, using default PDF fonts: {}", fontPath);
            return null;
        }
        log.info("Using font {} from {}", file.getName(), file.getAbsolutePath());
        return file;
    }
}
