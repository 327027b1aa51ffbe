package com.techlab.mailmerge.service;

import com.techlab.mailmerge.model.RowOutcome;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

public class ArchivePackagerTest {

    private final ArchivePackager packager = new ArchivePackager();

    @Test
    public void testPacksOnlySuccessfulOutcomes() throws IOException {
        List<RowOutcome> outcomes = List.of(
                RowOutcome.success(0, "a", bytes("A")),
                RowOutcome.failure(1, "b", "boom"),
                RowOutcome.success(2, "c", bytes("C")));

        List<String> names = entryNames(packager.pack(outcomes));

        assertThat(names).containsExactly("a.pdf", "c.pdf");
    }

    @Test
    public void testDuplicateNamesGetRowNumber() throws IOException {
        List<RowOutcome> outcomes = List.of(
                RowOutcome.success(0, "facture", bytes("1")),
                RowOutcome.success(1, "facture", bytes("2")),
                RowOutcome.success(2, "FACTURE", bytes("3")));

        List<String> names = entryNames(packager.pack(outcomes));

        assertThat(names).containsExactly("facture.pdf", "facture_2.pdf", "FACTURE_3.pdf");
    }

    @Test
    public void testUniqueEntryNameKeepsSearching() {
        Set<String> used = new HashSet<>(Set.of("doc.pdf", "doc_2.pdf"));

        assertThat(ArchivePackager.uniqueEntryName("doc", 2, used)).isEqualTo("doc_2_2.pdf");
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> entryNames(byte[] archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
