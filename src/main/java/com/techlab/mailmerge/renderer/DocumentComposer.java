package com.techlab.mailmerge.renderer;

import com.techlab.mailmerge.model.Assets;
import com.techlab.mailmerge.model.RenderRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Builds the complete HTML page for a render request: default stylesheet, template CSS, header
 * with logo and service name, the merged body and the signature.
 *
 * <p>The reserved placeholders {{logo}}, {{signature}} and {{service_name}} are filled here. When
 * the body places one of them itself, the matching header or signature block is not added.
 */
@Slf4j
@Component
public class DocumentComposer {

    private static final String DEFAULT_CSS_PATH = "templates/document-default.css";

    private static final String LOGO_TOKEN = "{{" + Assets.LOGO + "}}";
    private static final String SIGNATURE_TOKEN = "{{" + Assets.SIGNATURE + "}}";
    private static final String SERVICE_NAME_TOKEN = "{{" + Assets.SERVICE_NAME + "}}";

    // Editor artefacts: inline text colours and empty style attributes
    private static final Pattern INLINE_COLOR = Pattern.compile("style=\"color:\\s*rgb\\([^)]+\\);?\"");
    private static final Pattern EMPTY_STYLE = Pattern.compile("\\s*style=\"\"\\s*");

    private final String defaultCss;

    public DocumentComposer() {
        this.defaultCss = loadDefaultCss();
    }

    public String compose(RenderRequest request) {
        Assets assets = request.getAssets() != null ? request.getAssets() : Assets.NONE;
        String body = cleanEditorMarkup(request.getBody());

        boolean inlineLogo = body.contains(LOGO_TOKEN);
        boolean inlineSignature = body.contains(SIGNATURE_TOKEN);
        boolean inlineServiceName = body.contains(SERVICE_NAME_TOKEN);

        body = body
                .replace(LOGO_TOKEN, assets.hasLogo() ? image(assets.getLogo(), "Logo", "logo") : "")
                .replace(SIGNATURE_TOKEN, assets.hasSignature() ? image(assets.getSignature(), "Signature", "signature") : "")
                .replace(SERVICE_NAME_TOKEN, assets.hasServiceName() ? serviceNameHtml(assets.getServiceName()) : "");

        StringBuilder html = new StringBuilder(defaultCss.length() + body.length() + 1024);
        html.append("<!DOCTYPE html>\n<html lang=\"fr\">\n<head>\n<meta charset=\"UTF-8\"/>\n")
                .append("<title>").append(HtmlUtils.htmlEscape(request.getFilename() != null ? request.getFilename() : "document"))
                .append("</title>\n")
                .append("<style>\n").append(defaultCss).append('\n')
                .append(request.getCss() != null ? request.getCss() : "").append("\n</style>\n")
                .append("</head>\n<body>\n");

        String header = header(inlineLogo ? null : assets.getLogo(), inlineServiceName ? null : assets.getServiceName());
        html.append(header)
                .append("<div class=\"contenu\">\n")
                .append(body).append('\n');
        if (!inlineSignature && assets.hasSignature()) {
            html.append("<div class=\"signature-container\">")
                    .append(image(assets.getSignature(), "Signature", "signature"))
                    .append("</div>\n");
        }
        html.append("</div>\n</body>\n</html>");
        return html.toString();
    }

    String cleanEditorMarkup(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        String cleaned = INLINE_COLOR.matcher(body).replaceAll("");
        return EMPTY_STYLE.matcher(cleaned).replaceAll(" ");
    }

    private String header(String logo, String serviceName) {
        boolean hasLogo = logo != null && !logo.isBlank();
        boolean hasService = serviceName != null && !serviceName.isBlank();
        if (!hasLogo && !hasService) {
            return "";
        }
        return "<table class=\"entete\"><tr>"
                + "<td class=\"entete-logo\">" + (hasLogo ? image(logo, "Logo", "logo") : "") + "</td>"
                + "<td class=\"entete-service\">" + (hasService ? serviceNameHtml(serviceName) : "") + "</td>"
                + "</tr></table>\n<hr class=\"entete-separator\"/>\n";
    }

    private static String serviceNameHtml(String serviceName) {
        String[] lines = serviceName.replace("\r\n", "\n").split("\n");
        StringBuilder html = new StringBuilder("<div class=\"service-name\">");
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                html.append("<br/>");
            }
            html.append(HtmlUtils.htmlEscape(lines[i]));
        }
        return html.append("</div>").toString();
    }

    private static String image(String dataUri, String alt, String cssClass) {
        return "<img src=\"" + HtmlUtils.htmlEscape(dataUri) + "\" alt=\"" + alt + "\" class=\"" + cssClass + "\"/>";
    }

    private static String loadDefaultCss() {
        try (InputStream in = new ClassPathResource(DEFAULT_CSS_PATH).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Default document stylesheet missing: " + DEFAULT_CSS_PATH, e);
        }
    }
}
