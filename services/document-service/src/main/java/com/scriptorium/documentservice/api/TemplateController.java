package com.scriptorium.documentservice.api;

import com.scriptorium.documentservice.domain.DocumentTemplateService;
import com.scriptorium.templatemodel.DocumentTemplate;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the registered templates.
 *
 * <p>Every lookup returns a newly cloned template; nothing a client does with it reaches the
 * master.
 */
@RestController
@RequestMapping("/api/v1/templates")
public class TemplateController {

    private final DocumentTemplateService templateService;

    public TemplateController(DocumentTemplateService templateService) {
        this.templateService = templateService;
    }

    @GetMapping
    public Set<String> templateNames() {
        return templateService.templateNames();
    }

    @GetMapping("/{name}")
    public DocumentTemplate template(@PathVariable String name) {
        return templateService.create(name);
    }
}
