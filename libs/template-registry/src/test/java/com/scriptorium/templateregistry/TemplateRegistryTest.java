package com.scriptorium.templateregistry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.scriptorium.templatemodel.DocumentTemplate;
import com.scriptorium.templatemodel.testing.TestTemplateFactory;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TemplateRegistry}: registration, lookup misses, and the independence of each
 * dispensed clone from the others and from the stored master.
 */
@DisplayName("TemplateRegistry")
class TemplateRegistryTest {

    private TemplateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TemplateRegistry();
    }

    @Nested
    @DisplayName("register()")
    class Register {

        @Test
        @DisplayName("stores templates under their names")
        void storesByName() {
            registry.register("a", TestTemplateFactory.fullTemplate("A"));
            registry.register("b", TestTemplateFactory.fullTemplate("B"));

            assertThat(registry.size()).isEqualTo(2);
            assertThat(registry.names()).containsExactly("a", "b");
            assertThat(registry.contains("a")).isTrue();
        }

        @Test
        @DisplayName("overwrites an existing entry with the same name")
        void overwrites() {
            registry.register("contract", TestTemplateFactory.fullTemplate("Old"));
            registry.register("contract", TestTemplateFactory.fullTemplate("New"));

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.create("contract").getTitle()).isEqualTo("New");
        }

        @Test
        @DisplayName("keeps the exact instance, without copying on registration")
        void noCloneOnRegister() {
            var master = TestTemplateFactory.fullTemplate("Master");
            registry.register("m", master);

            // the registry owns the instance; a later edit by a misbehaving caller shows through
            master.setTitle("Edited");

            assertThat(registry.create("m").getTitle()).isEqualTo("Edited");
        }

        @Test
        @DisplayName("rejects blank names and null templates")
        void rejectsInvalidArguments() {
            var template = TestTemplateFactory.fullTemplate();

            assertThatThrownBy(() -> registry.register(null, template))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("  ", template))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("x", null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(registry.size()).isZero();
        }
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("returns a clone equal to, but distinct from, the master")
        void returnsClone() {
            var master = TestTemplateFactory.fullTemplate();
            registry.register("x", master);

            DocumentTemplate created = registry.create("x");

            assertThat(created).isEqualTo(master).isNotSameAs(master);
            assertThat(created.getSections().get(0)).isNotSameAs(master.getSections().get(0));
        }

        @Test
        @DisplayName("fails with TemplateNotFoundException naming the missing key")
        void missingName() {
            TemplateNotFoundException e = catchThrowableOfType(
                    () -> registry.create("nonexistent"), TemplateNotFoundException.class);

            assertThat(e).isNotNull().hasMessageContaining("nonexistent");
            assertThat(e.templateName()).isEqualTo("nonexistent");
        }

        @Test
        @DisplayName("fails for a null name")
        void nullName() {
            assertThatThrownBy(() -> registry.create(null))
                    .isInstanceOf(TemplateNotFoundException.class);
        }

        @Test
        @DisplayName("two clones of the same master do not share metadata")
        void twoIndependentClones() {
            registry.register("x", TestTemplateFactory.fullTemplate());

            var first = registry.create("x");
            var second = registry.create("x");
            assertThat(first).isEqualTo(second);

            first.getMetadata().put("Cliente", "ACME");

            assertThat(second.getMetadata()).doesNotContainKey("Cliente");
            assertThat(registry.create("x").getMetadata()).doesNotContainKey("Cliente");
        }

        @Test
        @DisplayName("five customized clones keep their own values and leave the master untouched")
        void fiveCustomizedClones() {
            registry.register("service_contract", TestTemplateFactory.fullTemplate());
            List<DocumentTemplate> contracts = new ArrayList<>();

            for (int i = 1; i <= 5; i++) {
                var contract = registry.create("service_contract");
                contract.setTitle("Contract #" + i);
                contract.getMetadata().put("Cliente", "Cliente " + i);
                contracts.add(contract);
            }

            var sixth = registry.create("service_contract");
            assertThat(sixth.getMetadata()).doesNotContainKey("Cliente");
            assertThat(sixth.getTitle()).isEqualTo("Test Template");
            for (int i = 0; i < contracts.size(); i++) {
                assertThat(contracts.get(i).getMetadata()).containsEntry("Cliente", "Cliente " + (i + 1));
                assertThat(contracts.get(i).getTitle()).isEqualTo("Contract #" + (i + 1));
            }
        }
    }

    @Nested
    @DisplayName("derived templates")
    class Derived {

        @Test
        @DisplayName("registering a derivation never back-mutates the original master")
        void derivationIsolation() {
            var a = TestTemplateFactory.fullTemplate("A");
            registry.register("A", a);

            var b = a.deepClone();
            b.setTitle("B");
            b.getTags().add("derived");
            b.getSections().get(0).setContent("Derived clause");
            registry.register("B", b);

            var createdA = registry.create("A");
            var createdB = registry.create("B");

            assertThat(createdA.getTitle()).isEqualTo("A");
            assertThat(createdA.getTags()).doesNotContain("derived");
            assertThat(createdA.getSections().get(0).getContent()).isEqualTo("First clause");
            assertThat(createdB.getTitle()).isEqualTo("B");
            assertThat(createdB.getTags()).endsWith("derived");
            assertThat(createdB.getSections().get(0).getContent()).isEqualTo("Derived clause");
        }
    }

    @Nested
    @DisplayName("deregister()")
    class Deregister {

        @Test
        @DisplayName("removes a registered master")
        void removes() {
            registry.register("x", TestTemplateFactory.fullTemplate());

            assertThat(registry.deregister("x")).isTrue();
            assertThat(registry.contains("x")).isFalse();
            assertThatThrownBy(() -> registry.create("x")).isInstanceOf(TemplateNotFoundException.class);
        }

        @Test
        @DisplayName("returns false for unknown names")
        void unknown() {
            assertThat(registry.deregister("nope")).isFalse();
            assertThat(registry.deregister(null)).isFalse();
        }
    }

    @Test
    @DisplayName("names() is a snapshot")
    void namesSnapshot() {
        registry.register("x", TestTemplateFactory.fullTemplate());
        var names = registry.names();
        registry.register("y", TestTemplateFactory.fullTemplate());

        assertThat(names).containsExactly("x");
    }
}
