package com.scriptorium.documentservice.domain;

import com.scriptorium.templatemodel.ApprovalWorkflow;
import com.scriptorium.templatemodel.DocumentStyle;
import com.scriptorium.templatemodel.DocumentTemplate;
import com.scriptorium.templatemodel.Margins;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/** Built-in contract masters. */
public final class ContractTemplates {

    public static final String SERVICE_CONTRACT = "service_contract";
    public static final String CONSULTING_CONTRACT = "consulting_contract";

    private ContractTemplates() {
        // utility class
    }

    /** Service agreement: three editable clauses, two approvers who must both sign. */
    public static DocumentTemplate serviceContract(Clock clock) {
        return DocumentTemplate.builder()
                .title("Contrato de Prestação de Serviços")
                .category("Contratos")
                .style(new DocumentStyle("Arial", 12, "#003366", "https://company.com/logo.png",
                        new Margins(2, 2, 3, 3)))
                .workflow(new ApprovalWorkflow(
                        List.of("gerente@empresa.com", "juridico@empresa.com"), 2, 5))
                .section("Cláusula 1 - Objeto", "O presente contrato tem por objeto...", true)
                .section("Cláusula 2 - Prazo", "O prazo de vigência será de...", true)
                .section("Cláusula 3 - Valor", "O valor total do contrato é de...", true)
                .requiredFields("NomeCliente", "CPF", "Endereco")
                .tags("contrato", "servicos")
                .metadata("Versao", "1.0")
                .metadata("Departamento", "Comercial")
                .metadata("UltimaRevisao",
                        LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .build();
    }

    /** Consulting agreement, derived from {@code serviceContract} by clone-then-edit. */
    public static DocumentTemplate consultingContract(DocumentTemplate serviceContract) {
        DocumentTemplate template = serviceContract.deepClone();
        template.setTitle("Contrato de Consultoria");
        template.getTags().add("consultoria");
        template.getSections().get(0).setContent("O presente contrato de consultoria tem por objeto...");
        return template;
    }
}
