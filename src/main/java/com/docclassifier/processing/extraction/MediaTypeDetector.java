package com.docclassifier.processing.extraction;

import org.apache.poi.poifs.filesystem.DirectoryNode;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Sniffs a media type from the leading bytes of a document. The filename is never consulted.
 * Tika supplies the base type; Office containers are opened to tell Word from Excel.
 */
@Component
public class MediaTypeDetector {

    private static final Logger logger = LoggerFactory.getLogger(MediaTypeDetector.class);

    public static final String PDF = "application/pdf";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    public static final String DOC = "application/msword";
    public static final String XLS = "application/vnd.ms-excel";
    public static final String ENCRYPTED_OOXML = "application/x-tika-ooxml-protected";
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final String ZIP = "application/zip";
    private static final String OOXML = "application/x-tika-ooxml";
    private static final String OLE2 = "application/x-tika-msoffice";

    private final Tika tika = new Tika();

    public String detect(byte[] content) {
        if (content == null || content.length == 0) {
            return OCTET_STREAM;
        }
        String base = tika.detect(content);
        if (ZIP.equals(base) || OOXML.equals(base)) {
            return inspectZip(content, base);
        }
        if (OLE2.equals(base)) {
            return inspectOle2(content, base);
        }
        return base;
    }

    private String inspectZip(byte[] content, String base) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (name.startsWith("word/")) {
                    return DOCX;
                }
                if (name.startsWith("xl/")) {
                    return XLSX;
                }
            }
        } catch (IOException e) {
            logger.debug("Zip container could not be inspected: {}", e.getMessage());
        }
        return base;
    }

    private String inspectOle2(byte[] content, String base) {
        try (POIFSFileSystem fs = new POIFSFileSystem(new ByteArrayInputStream(content))) {
            DirectoryNode root = fs.getRoot();
            if (root.hasEntry("WordDocument")) {
                return DOC;
            }
            if (root.hasEntry("Workbook") || root.hasEntry("Book")) {
                return XLS;
            }
            if (root.hasEntry("EncryptedPackage")) {
                return ENCRYPTED_OOXML;
            }
        } catch (IOException e) {
            logger.debug("OLE2 container could not be inspected: {}", e.getMessage());
        }
        return base;
    }
}
