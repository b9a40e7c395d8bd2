package com.vedant.dataquery.util;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.SourceFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Single pass, lazy walk over the file entries of a zip archive. Directory entries are skipped.
 */
public final class ArchiveExpander {

    private ArchiveExpander() {}

    /**
     * One file inside an archive.
     *
     * @param path full entry path inside the archive
     * @param name base name of the entry, used as the file label
     */
    public record ArchiveMember(String path, String name, byte[] content) {

        public FileFormat format() {
            return FileFormat.fromFileName(name);
        }
    }

    /**
     * @throws IngestionException from the iterator when the archive is corrupt or holds no entries
     */
    public static Iterator<ArchiveMember> expand(SourceFile archive) {
        return new MemberIterator(archive.name(), new ZipInputStream(new ByteArrayInputStream(archive.content())));
    }

    static String baseName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static final class MemberIterator implements Iterator<ArchiveMember> {

        private final String archiveName;
        private final ZipInputStream zip;
        private ArchiveMember next;
        private boolean anyEntry;
        private boolean done;

        MemberIterator(String archiveName, ZipInputStream zip) {
            this.archiveName = archiveName;
            this.zip = zip;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) advance();
            return next != null;
        }

        @Override
        public ArchiveMember next() {
            if (!hasNext()) throw new NoSuchElementException();
            ArchiveMember m = next;
            next = null;
            return m;
        }

        private void advance() {
            try {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    anyEntry = true;
                    if (entry.isDirectory()) continue;
                    next = new ArchiveMember(entry.getName(), baseName(entry.getName()), zip.readAllBytes());
                    return;
                }
                done = true;
                zip.close();
                if (!anyEntry) {
                    throw new IngestionException("Could not open archive " + archiveName + ": no entries found");
                }
            } catch (IOException e) {
                done = true;
                throw new IngestionException("Could not open archive " + archiveName + ": " + e.getMessage(), e);
            }
        }
    }
}
