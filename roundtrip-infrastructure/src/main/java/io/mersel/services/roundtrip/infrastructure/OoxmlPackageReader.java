package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.interfaces.DocumentParseException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * ZIP ile paketlenmiş OOXML dosyasından karşılaştırılacak XML parçalarını okur.
 * <p>
 * Yalnızca {@code word/}, {@code ppt/}, {@code xl/} ve {@code docProps/} altındaki
 * {@code .xml} parçaları alınır; ilişki dosyaları ve ikili medya atlanır.
 */
final class OoxmlPackageReader {

    private static final String[] PART_ROOTS = {"word/", "ppt/", "xl/", "docProps/"};

    /** Sıkıştırılmış bombalara karşı parça başına üst sınır. */
    private static final long MAX_PART_BYTES = 64L * 1024 * 1024;

    private OoxmlPackageReader() {
    }

    /**
     * İçerik ZIP imzası ({@code PK\3\4}) ile mi başlıyor?
     */
    static boolean isPackage(byte[] content) {
        return content != null && content.length >= 4
                && content[0] == 'P' && content[1] == 'K' && content[2] == 3 && content[3] == 4;
    }

    /**
     * Paket içindeki XML parçalarını ada göre sıralı döndürür.
     *
     * @throws DocumentParseException paket bozuksa veya karşılaştırılabilir parça yoksa
     */
    static Map<String, byte[]> readParts(byte[] content, String sourceName) throws DocumentParseException {
        var parts = new TreeMap<String, byte[]>();
        try (var zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (entry.isDirectory() || !isComparablePart(name)) {
                    continue;
                }
                byte[] data = zip.readNBytes((int) Math.min(MAX_PART_BYTES + 1, Integer.MAX_VALUE - 8));
                if (data.length > MAX_PART_BYTES) {
                    throw new DocumentParseException(sourceName,
                            "Paket parçası çok büyük: " + name + " (" + sourceName + ")");
                }
                parts.put(name, data);
            }
        } catch (ZipException e) {
            throw new DocumentParseException(sourceName, "Bozuk OOXML paketi: " + sourceName + " - " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocumentParseException(sourceName, "OOXML paketi okunamadı: " + sourceName + " - " + e.getMessage(), e);
        }
        if (parts.isEmpty()) {
            throw new DocumentParseException(sourceName, "OOXML paketinde karşılaştırılabilir XML parçası yok: " + sourceName);
        }
        return Collections.unmodifiableMap(parts);
    }

    static boolean isComparablePart(String name) {
        if (!name.endsWith(".xml") || name.contains("/_rels/")) {
            return false;
        }
        for (String root : PART_ROOTS) {
            if (name.startsWith(root)) {
                return true;
            }
        }
        return false;
    }
}
