package com.chambua.inventory.importing;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns uploaded bytes into CSV rows. Candidate encodings are tried in a fixed order and
 * the first one that decodes every byte to a usable character wins.
 */
@Component
public class CsvDecoder {

    private static final Logger log = LoggerFactory.getLogger(CsvDecoder.class);

    static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            StandardCharsets.ISO_8859_1,
            WINDOWS_1252
    );

    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();

    public DecodedTable decode(byte[] content) {
        List<String> attempted = new ArrayList<>();
        for (Charset charset : CANDIDATES) {
            attempted.add(charset.name());
            String text = tryDecode(content, charset);
            if (text == null) continue;
            if (charset.equals(StandardCharsets.UTF_8) && !text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }
            log.debug("Decoded {} bytes as {}", content.length, charset.name());
            return new DecodedTable(parse(text, charset.name()), charset.name());
        }
        throw new DecodeFailureException(attempted);
    }

    private static String tryDecode(byte[] content, Charset charset) {
        String text;
        try {
            text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
        boolean singleByte = !charset.equals(StandardCharsets.UTF_8);
        for (int i = 0; i < text.length(); i++) {
            if (!acceptable(text.charAt(i), singleByte)) return null;
        }
        return text;
    }

    // C1 controls from a single-byte decode mean the bytes belong to another code page
    private static boolean acceptable(char c, boolean singleByte) {
        if (c == '\uFFFD' || c == '\u0000') return false;
        return !(singleByte && c >= '\u0080' && c <= '\u009F');
    }

    private static List<List<String>> parse(String text, String encoding) {
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            for (CSVRecord rec : parser) {
                List<String> cells = new ArrayList<>(rec.size());
                for (int i = 0; i < rec.size(); i++) {
                    cells.add(rec.get(i));
                }
                rows.add(cells);
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new DecodeFailureException(encoding, e);
        }
        return rows;
    }
}
