package com.scriptorium.documentservice.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.scriptorium.templatemodel.DocumentTemplate;
import com.scriptorium.templatemodel.Section;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContractTemplates")
class ContractTemplatesTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T09:30:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("service contract has three clauses and a two-of-two workflow")
    void serviceContract() {
        DocumentTemplate contract = ContractTemplates.serviceContract(CLOCK);

        assertThat(contract.getTitle()).isEqualTo("Contrato de Prestação de Serviços");
        assertThat(contract.getSections()).hasSize(3).allMatch(Section::isEditable);
        assertThat(contract.getWorkflow().getApprovers())
                .containsExactly("gerente@empresa.com", "juridico@empresa.com");
        assertThat(contract.getWorkflow().getRequiredApprovals()).isEqualTo(2);
        assertThat(contract.getWorkflow().isSatisfiable()).isTrue();
        assertThat(contract.getStyle().getPageMargins().getLeft()).isEqualTo(3);
        assertThat(contract.getRequiredFields()).containsExactly("NomeCliente", "CPF", "Endereco");
        assertThat(contract.getMetadata())
                .containsEntry("Versao", "1.0")
                .containsEntry("UltimaRevisao", "2026-01-15T09:30:00");
    }

    @Test
    @DisplayName("consulting contract is derived without touching the service contract")
    void consultingContract() {
        DocumentTemplate service = ContractTemplates.serviceContract(CLOCK);
        DocumentTemplate snapshot = service.deepClone();

        DocumentTemplate consulting = ContractTemplates.consultingContract(service);

        assertThat(consulting.getTitle()).isEqualTo("Contrato de Consultoria");
        assertThat(consulting.getTags()).containsExactly("contrato", "servicos", "consultoria");
        assertThat(consulting.getSections().get(0).getContent())
                .isEqualTo("O presente contrato de consultoria tem por objeto...");
        assertThat(consulting.getSections().get(1)).isEqualTo(service.getSections().get(1));
        assertThat(service).isEqualTo(snapshot);
    }
}
