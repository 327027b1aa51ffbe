package com.techlab.mailmerge.service;

import com.techlab.mailmerge.exception.PackagingException;
import com.techlab.mailmerge.model.RowOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Bundles the successful documents of a batch into one ZIP archive.
 */
@Slf4j
@Component
public class ArchivePackager {

    private static final String EXTENSION = ".pdf";

    public byte[] pack(List<RowOutcome> outcomes) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(64 * 1024);
        Set<String> usedNames = new HashSet<>();
        int entries = 0;

        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (RowOutcome outcome : outcomes) {
                if (!outcome.isSuccess()) {
                    continue;
                }
                String entryName = uniqueEntryName(outcome.getFilename(), outcome.getRowIndex() + 1, usedNames);
                zip.putNextEntry(new ZipEntry(entryName));
                zip.write(outcome.getContent());
                zip.closeEntry();
                entries++;
            }
            zip.finish();
        } catch (IOException e) {
            throw new PackagingException("Failed to build the document archive", e);
        }

        log.debug("Packed {} documents into archive ({} bytes)", entries, buffer.size());
        return buffer.toByteArray();
    }

    /**
     * Appends the row number to a name already taken. Comparison ignores case, since archives
     * are often extracted on case-insensitive filesystems.
     */
    static String uniqueEntryName(String filename, int rowNumber, Set<String> usedNames) {
        String candidate = filename + EXTENSION;
        if (usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
            return candidate;
        }
        candidate = filename + "_" + rowNumber + EXTENSION;
        int attempt = 2;
        while (!usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = filename + "_" + rowNumber + "_" + attempt++ + EXTENSION;
        }
        return candidate;
    }
}
