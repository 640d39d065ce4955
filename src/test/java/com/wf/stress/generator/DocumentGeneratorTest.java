package com.wf.stress.generator;

import com.wf.stress.config.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentGeneratorTest {

    private DocumentGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DocumentGenerator(new RandomDataProvider());
    }

    @Nested
    class GenerateTests {

        @Test
        void shouldStayWithinFieldCountBounds() {
            for (int maxFields : new int[] {1, 2, 5, 50}) {
                for (int i = 0; i < 200; i++) {
                    GeneratedDocument doc = generator.generate(maxFields, 20);

                    assertThat(doc.getFieldCount()).isBetween(1, maxFields);
                }
            }
        }

        @Test
        void shouldGenerateLowercaseKeysAndValuesWithinLengthBounds() {
            for (int i = 0; i < 100; i++) {
                GeneratedDocument doc = generator.generate(10, 30);

                for (Map.Entry<String, String> field : doc.getFields().entrySet()) {
                    assertThat(field.getKey()).matches("[a-z]{1,10}");
                    assertThat(field.getValue()).matches("[a-z]{1,30}");
                }
            }
        }

        @Test
        void shouldProduceSingleFieldSingleCharDocumentsAtMinimumBounds() {
            GeneratedDocument doc = generator.generate(1, 1);

            assertThat(doc.getFieldCount()).isEqualTo(1);
            assertThat(doc.getFields().values()).allMatch(v -> v.length() == 1);
        }

        @Test
        void shouldRejectZeroMaxFields() {
            assertThatThrownBy(() -> generator.generate(0, 10))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("fields");
        }

        @Test
        void shouldRejectZeroFieldSize() {
            assertThatThrownBy(() -> generator.generate(10, 0))
                .isInstanceOf(ConfigException.class);
        }
    }

    @Nested
    class PoolTests {

        @Test
        void shouldContainBasesPlusVariants() {
            DocumentPool pool = generator.buildPool(25, 10, 8, 16);

            assertThat(pool.size()).isEqualTo(35);
            assertThat(pool.getBaseCount()).isEqualTo(25);
            assertThat(pool.getVariantCount()).isEqualTo(10);
        }

        @Test
        void shouldDeriveVariantsFromExistingFieldSets() {
            DocumentPool pool = generator.buildPool(3, 30, 6, 16);

            Set<Set<String>> baseShapes = new HashSet<>();
            for (int i = 0; i < pool.getBaseCount(); i++) {
                baseShapes.add(pool.getDocuments().get(i).getFields().keySet());
            }

            for (int i = pool.getBaseCount(); i < pool.size(); i++) {
                assertThat(baseShapes).contains(pool.getDocuments().get(i).getFields().keySet());
            }
        }

        @Test
        void shouldKeepFieldNamesAndRandomizeValuesInVariant() {
            GeneratedDocument template = new GeneratedDocument(Map.of("alpha", "a", "beta", "b"));

            GeneratedDocument variant = generator.deriveVariant(template, 40);

            assertThat(variant).isNotSameAs(template);
            assertThat(variant.getFields().keySet()).containsExactlyInAnyOrder("alpha", "beta");
            assertThat(variant.getFields().values()).allMatch(v -> v.matches("[a-z]{1,40}"));
            assertThat(template.getFields()).containsEntry("alpha", "a").containsEntry("beta", "b");
        }

        @Test
        void shouldAllowPoolWithoutVariants() {
            DocumentPool pool = generator.buildPool(5, 0, 3, 3);

            assertThat(pool.size()).isEqualTo(5);
        }

        @Test
        void shouldFailBeforeGeneratingWhenBoundsInvalid() {
            assertThatThrownBy(() -> generator.buildPool(10, 10, 0, 10))
                .isInstanceOf(ConfigException.class);
            assertThatThrownBy(() -> generator.buildPool(0, 10, 10, 10))
                .isInstanceOf(ConfigException.class);
            assertThatThrownBy(() -> generator.buildPool(10, -1, 10, 10))
                .isInstanceOf(ConfigException.class);
        }

        @Test
        void shouldNotAllowPoolMutation() {
            DocumentPool pool = generator.buildPool(2, 0, 2, 2);

            assertThatThrownBy(() -> pool.getDocuments().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
