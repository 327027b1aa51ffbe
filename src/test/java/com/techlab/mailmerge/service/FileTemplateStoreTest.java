package com.techlab.mailmerge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.exception.InvalidInputException;
import com.techlab.mailmerge.exception.ResourceNotFoundException;
import com.techlab.mailmerge.model.StoredTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileTemplateStoreTest {

    @TempDir
    Path templateDir;

    private FileTemplateStore store;

    @BeforeEach
    public void setUp() {
        store = new FileTemplateStore(templateDir.resolve("templates").toString(), new ObjectMapper().findAndRegisterModules());
    }

    private static StoredTemplate template(String name, String content) {
        return StoredTemplate.builder()
                .name(name)
                .templateContent(content)
                .templateCss("p { margin: 0; }")
                .logo("data:image/png;base64,AAAA")
                .serviceName("Service RH")
                .tableId("Agents")
                .build();
    }

    @Test
    public void testSaveAndLoad() {
        String savedName = store.save(template("Convocation jury", "<p>{{Nom}}</p>"));

        assertThat(savedName).isEqualTo("Convocation_jury");
        assertThat(Files.exists(templateDir.resolve("templates").resolve("Convocation_jury.json"))).isTrue();

        StoredTemplate loaded = store.load("Convocation jury");
        assertThat(loaded.getName()).isEqualTo("Convocation jury");
        assertThat(loaded.getTemplateContent()).isEqualTo("<p>{{Nom}}</p>");
        assertThat(loaded.getTableId()).isEqualTo("Agents");
        assertThat(loaded.toAssets().getServiceName()).isEqualTo("Service RH");
        assertThat(loaded.getCreatedAt()).isNotNull();
        assertThat(loaded.getUpdatedAt()).isNotNull();
    }

    @Test
    public void testUpdateKeepsCreationDate() throws InterruptedException {
        store.save(template("lettre", "v1"));
        StoredTemplate first = store.load("lettre");
        Thread.sleep(5);

        store.save(template("lettre", "v2"));
        StoredTemplate second = store.load("lettre");

        assertThat(second.getTemplateContent()).isEqualTo("v2");
        assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(second.getUpdatedAt()).isAfter(first.getUpdatedAt());
    }

    @Test
    public void testListMostRecentFirst() throws InterruptedException {
        assertThat(store.list()).isEmpty();

        store.save(template("alpha", "a"));
        Thread.sleep(5);
        store.save(template("beta", "b"));
        assertThat(store.list()).containsExactly("beta", "alpha");

        Thread.sleep(5);
        store.save(template("alpha", "a2"));
        assertThat(store.list()).containsExactly("alpha", "beta");
    }

    @Test
    public void testUnreadableFilesAreSkipped() throws Exception {
        store.save(template("valide", "ok"));
        Files.writeString(templateDir.resolve("templates").resolve("casse.json"), "{not json");

        assertThat(store.list()).containsExactly("valide");
    }

    @Test
    public void testDelete() {
        store.save(template("temp", "x"));

        store.delete("temp");

        assertThat(store.list()).isEmpty();
        assertThatThrownBy(() -> store.load("temp")).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> store.delete("temp")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    public void testValidation() {
        assertThatThrownBy(() -> store.save(template("  ", "x"))).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> store.save(template("nom", " "))).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> store.load("../")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    public void testConcurrentSavesOfSameTemplate() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> saves = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String content = "<p>version " + i + "</p>";
                saves.add(pool.submit(() -> store.save(template("Attestation", content))));
            }
            for (Future<String> save : saves) {
                assertThat(save.get(10, TimeUnit.SECONDS)).isEqualTo("Attestation");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.load("Attestation").getTemplateContent()).startsWith("<p>version ");
        try (Stream<Path> files = Files.list(templateDir.resolve("templates"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("Attestation.json");
        }
    }

    @Test
    public void testSafeName() {
        assertThat(FileTemplateStore.safeName("Modèle n°1 / été ")).isEqualTo("Modèle_n1__été");
        assertThat(FileTemplateStore.safeName("../../etc/passwd")).isEqualTo("etcpasswd");
        assertThat(FileTemplateStore.safeName(null)).isEmpty();
    }
}
