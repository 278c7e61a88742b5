package io.github.drompincen.chatrelay.runtime.file;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extracts text from attachments: images are passed through as base64, PDFs go through PDFBox,
 * Word and Excel documents through Apache POI, text-like files by extension. Anything else becomes
 * a one-line binary placeholder.
 */
public class DefaultFileProcessor implements FileProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultFileProcessor.class);

    static final int MAX_SHEET_ROWS = 1000;

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp", ".svg", ".ico");

    private static final Set<String> TEXT_EXTENSIONS = Set.of(
            ".txt", ".md", ".markdown",
            ".go", ".js", ".ts", ".py", ".java", ".c", ".cpp", ".h", ".cs", ".rb", ".php",
            ".html", ".css", ".scss", ".sass", ".less",
            ".json", ".yaml", ".yml", ".xml", ".toml", ".ini", ".conf", ".config", ".properties",
            ".sh", ".bash", ".zsh", ".fish", ".ps1", ".bat", ".cmd",
            ".sql", ".log", ".csv", ".tsv", ".env", ".gitignore", ".dockerignore", ".dockerfile", ".makefile",
            ".rst", ".tex", ".r", ".scala", ".swift", ".kt", ".groovy", ".lua", ".vim", ".el", ".clj",
            ".erl", ".ex", ".exs", ".dart", ".proto");

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            ".go", ".js", ".ts", ".py", ".java", ".c", ".cpp", ".h", ".cs", ".rb", ".php");

    private static final String DOCX_MIME =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    private static final String XLSX_MIME =
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Override
    public ProcessedFile process(String name, byte[] content) throws FileProcessingException {
        if (content == null || content.length == 0) {
            throw new FileProcessingException("empty file: " + name);
        }
        String ext = extension(name);
        String contentType = detectContentType(name, content, ext);
        log.debug("Processing file name={} mime={} ext={} size={}", name, contentType, ext, content.length);

        if (contentType.startsWith("image/") || IMAGE_EXTENSIONS.contains(ext)) {
            return processImage(name, contentType, content);
        }
        if (contentType.equals("application/pdf") || ext.equals(".pdf")) {
            return processPdf(name, contentType, content);
        }
        if (contentType.equals(DOCX_MIME) || ext.equals(".docx")) {
            return processDocx(name, contentType, content);
        }
        if (contentType.equals(XLSX_MIME) || ext.equals(".xlsx")) {
            return processXlsx(name, contentType, content);
        }
        if (contentType.startsWith("text/") || TEXT_EXTENSIONS.contains(ext)) {
            return processText(name, contentType, content, ext);
        }
        return processBinary(name, contentType, content);
    }

    private ProcessedFile processImage(String name, String contentType, byte[] content)
            throws FileProcessingException {
        if (content.length > FileLimits.MAX_IMAGE_SIZE) {
            throw new FileProcessingException("image exceeds the "
                    + FileLimits.MAX_IMAGE_SIZE / FileLimits.MB + " MB limit");
        }
        String kind = imageKind(content);
        if (kind == null) {
            throw new FileProcessingException("file is not a valid image");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image != null) {
                metadata.put("width", image.getWidth());
                metadata.put("height", image.getHeight());
            }
        } catch (IOException e) {
            log.debug("Could not decode image {} for dimensions: {}", name, e.getMessage());
        }
        metadata.put("format", kind);
        String mime = contentType.startsWith("image/") ? contentType : "image/" + kind;
        log.info("Image processed name={} format={} metadata={}", name, kind, metadata);
        return new ProcessedFile(name, Base64.getEncoder().encodeToString(content), mime,
                FileType.IMAGE, content.length, true, metadata);
    }

    private ProcessedFile processPdf(String name, String contentType, byte[] content)
            throws FileProcessingException {
        if (content.length > FileLimits.MAX_PDF_SIZE) {
            throw new FileProcessingException("PDF exceeds the "
                    + FileLimits.MAX_PDF_SIZE / FileLimits.MB + " MB limit");
        }
        StringBuilder text = new StringBuilder();
        int pages;
        try (PDDocument doc = Loader.loadPDF(content)) {
            pages = doc.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= pages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append("\n--- Page ").append(page).append(" ---\n");
                text.append(stripper.getText(doc));
            }
        } catch (IOException e) {
            throw new FileProcessingException("could not open PDF: " + e.getMessage(), e);
        }
        if (text.toString().replaceAll("--- Page \\d+ ---", "").isBlank()) {
            throw new FileProcessingException("could not extract text from PDF");
        }
        log.info("PDF processed name={} pages={} textLength={}", name, pages, text.length());
        return new ProcessedFile(name, text.toString(), "application/pdf", FileType.PDF,
                content.length, false, Map.of("pages", pages));
    }

    private ProcessedFile processDocx(String name, String contentType, byte[] content)
            throws FileProcessingException {
        checkDocSize(content, "document");
        StringBuilder text = new StringBuilder();
        int paragraphs = 0;
        int tables = 0;
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(content))) {
            for (XWPFParagraph paragraph : doc.getParagraphs()) {
                String line = paragraph.getText();
                if (line != null && !line.isBlank()) {
                    text.append(line).append('\n');
                    paragraphs++;
                }
            }
            for (XWPFTable table : doc.getTables()) {
                tables++;
                text.append("\n--- Table ").append(tables).append(" ---\n");
                for (XWPFTableRow row : table.getRows()) {
                    for (XWPFTableCell cell : row.getTableCells()) {
                        String value = cell.getText();
                        if (value != null && !value.isBlank()) {
                            text.append(value).append(" | ");
                        }
                    }
                    text.append('\n');
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new FileProcessingException("could not open Word document: " + e.getMessage(), e);
        }
        if (text.toString().isBlank()) {
            throw new FileProcessingException("Word document is empty");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paragraphs", paragraphs);
        metadata.put("tables", tables);
        log.info("Word document processed name={} paragraphs={} tables={}", name, paragraphs, tables);
        return new ProcessedFile(name, text.toString(), DOCX_MIME, FileType.DOCX, content.length, false, metadata);
    }

    private ProcessedFile processXlsx(String name, String contentType, byte[] content)
            throws FileProcessingException {
        checkDocSize(content, "spreadsheet");
        StringBuilder text = new StringBuilder();
        int sheets;
        DataFormatter formatter = new DataFormatter();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            sheets = workbook.getNumberOfSheets();
            for (Sheet sheet : workbook) {
                text.append("\n=== Sheet: ").append(sheet.getSheetName()).append(" ===\n");
                int rowCount = sheet.getPhysicalNumberOfRows();
                int index = 0;
                for (Row row : sheet) {
                    if (index++ >= MAX_SHEET_ROWS) {
                        text.append("\n... (").append(rowCount - MAX_SHEET_ROWS).append(" more rows omitted)\n");
                        break;
                    }
                    boolean first = true;
                    for (Cell cell : row) {
                        if (!first) {
                            text.append(" | ");
                        }
                        text.append(formatter.formatCellValue(cell));
                        first = false;
                    }
                    text.append('\n');
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new FileProcessingException("could not open Excel workbook: " + e.getMessage(), e);
        }
        if (text.toString().replaceAll("=== Sheet: .* ===", "").isBlank()) {
            throw new FileProcessingException("Excel workbook is empty");
        }
        log.info("Excel workbook processed name={} sheets={}", name, sheets);
        return new ProcessedFile(name, text.toString(), XLSX_MIME, FileType.XLSX, content.length, false,
                Map.of("sheets", sheets));
    }

    private ProcessedFile processText(String name, String contentType, byte[] content, String ext) {
        String text = new String(content, StandardCharsets.UTF_8);
        Map<String, Object> metadata = new LinkedHashMap<>();
        FileType type = switch (ext) {
            case ".json" -> FileType.JSON;
            case ".yaml", ".yml" -> FileType.YAML;
            case ".xml" -> FileType.XML;
            case ".md", ".markdown" -> FileType.MARKDOWN;
            case ".csv" -> FileType.CSV;
            default -> CODE_EXTENSIONS.contains(ext) ? FileType.CODE : FileType.TEXT;
        };
        if (type == FileType.CODE) {
            metadata.put("language", ext.substring(1));
        }
        metadata.put("lines", text.split("\n", -1).length);
        log.debug("Text file processed name={} type={} lines={}", name, type.label(), metadata.get("lines"));
        return new ProcessedFile(name, text, contentType, type, content.length, false, metadata);
    }

    private ProcessedFile processBinary(String name, String contentType, byte[] content) {
        log.warn("Binary file not processed name={} type={}", name, contentType);
        String placeholder = "[Binary file: " + name + " - " + content.length + " bytes - Type: " + contentType + "]";
        return new ProcessedFile(name, placeholder, contentType, FileType.BINARY, content.length, false, Map.of());
    }

    private static void checkDocSize(byte[] content, String what) throws FileProcessingException {
        if (content.length > FileLimits.MAX_DOC_SIZE) {
            throw new FileProcessingException(what + " exceeds the "
                    + FileLimits.MAX_DOC_SIZE / FileLimits.MB + " MB limit");
        }
    }

    static String extension(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (dot <= slash || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String detectContentType(String name, byte[] content, String ext) {
        String kind = imageKind(content);
        if (kind != null) {
            return "image/" + kind;
        }
        if (startsWith(content, "%PDF")) {
            return "application/pdf";
        }
        if (ext.equals(".docx")) {
            return DOCX_MIME;
        }
        if (ext.equals(".xlsx")) {
            return XLSX_MIME;
        }
        String guessed = URLConnection.guessContentTypeFromName(name);
        if (guessed != null) {
            return guessed;
        }
        return looksLikeText(content) ? "text/plain" : "application/octet-stream";
    }

    /** Magic-byte check for the raster formats we pass through. */
    static String imageKind(byte[] c) {
        if (c.length >= 8 && (c[0] & 0xFF) == 0x89 && c[1] == 'P' && c[2] == 'N' && c[3] == 'G') {
            return "png";
        }
        if (c.length >= 3 && (c[0] & 0xFF) == 0xFF && (c[1] & 0xFF) == 0xD8 && (c[2] & 0xFF) == 0xFF) {
            return "jpeg";
        }
        if (startsWith(c, "GIF87a") || startsWith(c, "GIF89a")) {
            return "gif";
        }
        if (startsWith(c, "BM") && c.length > 14) {
            // header carries the file size, little-endian
            long declared = (c[2] & 0xFFL) | (c[3] & 0xFFL) << 8 | (c[4] & 0xFFL) << 16 | (c[5] & 0xFFL) << 24;
            if (declared == c.length) {
                return "bmp";
            }
        }
        if (c.length >= 12 && startsWith(c, "RIFF") && c[8] == 'W' && c[9] == 'E' && c[10] == 'B' && c[11] == 'P') {
            return "webp";
        }
        if (c.length >= 4 && c[0] == 0 && c[1] == 0 && c[2] == 1 && c[3] == 0) {
            return "ico";
        }
        return null;
    }

    private static boolean startsWith(byte[] content, String prefix) {
        byte[] p = prefix.getBytes(StandardCharsets.US_ASCII);
        if (content.length < p.length) {
            return false;
        }
        for (int i = 0; i < p.length; i++) {
            if (content[i] != p[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksLikeText(byte[] content) {
        int sample = Math.min(content.length, 512);
        for (int i = 0; i < sample; i++) {
            if (content[i] == 0) {
                return false;
            }
        }
        return true;
    }
}
