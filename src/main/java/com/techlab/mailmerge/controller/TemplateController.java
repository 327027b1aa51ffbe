package com.techlab.mailmerge.controller;

import com.techlab.mailmerge.model.SaveTemplateRequest;
import com.techlab.mailmerge.model.StoredTemplate;
import com.techlab.mailmerge.service.TemplateStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for template management: save, list, load, delete
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateStore templateStore;

    /**
     * Save a template with its assets, replacing any template of the same name
     *
     * POST /api/save-template
     */
    @PostMapping("/save-template")
    public ResponseEntity<Map<String, Object>> saveTemplate(@Valid @RequestBody SaveTemplateRequest request) {
        log.info("Saving template: {}", request.getTemplateName());

        String savedName = templateStore.save(StoredTemplate.builder()
                .name(request.getTemplateName())
                .templateContent(request.getTemplateContent())
                .templateCss(request.getTemplateCss())
                .logo(request.getLogo())
                .signature(request.getSignature())
                .serviceName(request.getServiceName())
                .tableId(request.getTableId())
                .build());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Template saved successfully");
        response.put("template_name", savedName);
        return ResponseEntity.ok(response);
    }

    /**
     * List template names, most recently updated first
     *
     * GET /api/templates
     */
    @GetMapping("/templates")
    public ResponseEntity<Map<String, Object>> listTemplates() {
        List<String> templates = templateStore.list();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("templates", templates);
        response.put("count", templates.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/template/{templateName}")
    public ResponseEntity<Map<String, Object>> loadTemplate(@PathVariable String templateName) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("template", templateStore.load(templateName));
        return ResponseEntity.ok(response);
    }

    /**
     * Delete a template
     *
     * DELETE /api/template/{templateName}
     */
    @DeleteMapping("/template/{templateName}")
    public ResponseEntity<Map<String, Object>> deleteTemplate(@PathVariable String templateName) {
        log.info("Deleting template: {}", templateName);
        templateStore.delete(templateName);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Template deleted: " + templateName);
        return ResponseEntity.ok(response);
    }
}
