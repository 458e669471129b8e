package com.chambua.inventory.importing;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvDecoderTest {

    private final CsvDecoder decoder = new CsvDecoder();

    @Test
    void decodesUtf8AndStripsByteOrderMark() {
        byte[] body = "SKU,Name,Selling Price\nA-1,Chai Masala,250\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF; withBom[1] = (byte) 0xBB; withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        DecodedTable table = decoder.decode(withBom);

        assertThat(table.encoding()).isEqualTo("UTF-8");
        assertThat(table.header()).containsExactly("SKU", "Name", "Selling Price");
        assertThat(table.dataRows()).containsExactly(List.of("A-1", "Chai Masala", "250"));
    }

    @Test
    void fallsBackToLatin1ForSingleByteAccents() {
        byte[] content = "SKU,Name,Selling Price\nA-1,Café,10\n".getBytes(StandardCharsets.ISO_8859_1);

        DecodedTable table = decoder.decode(content);

        assertThat(table.encoding()).isEqualTo("ISO-8859-1");
        assertThat(table.dataRows().get(0).get(1)).isEqualTo("Café");
    }

    @Test
    void usesWindows1252WhenLatin1WouldYieldControlCharacters() {
        byte[] prefix = "SKU,Name,Selling Price\nA-1,Price ".getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[prefix.length + 4];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0x80; // euro sign in windows-1252
        content[prefix.length + 1] = ',';
        content[prefix.length + 2] = '5';
        content[prefix.length + 3] = '\n';

        DecodedTable table = decoder.decode(content);

        assertThat(table.encoding()).isEqualTo("windows-1252");
        assertThat(table.dataRows().get(0).get(1)).isEqualTo("Price €");
    }

    @Test
    void failsWhenNoCandidateDecodesEveryByte() {
        byte[] content = {'S', 'K', 'U', '\n', (byte) 0x81, '\n'};

        assertThatThrownBy(() -> decoder.decode(content))
                .isInstanceOf(DecodeFailureException.class)
                .hasMessage("Could not decode file. Tried encodings: UTF-8, ISO-8859-1, windows-1252")
                .satisfies(e -> {
                    DecodeFailureException failure = (DecodeFailureException) e;
                    assertThat(failure.kind()).isEqualTo(ImportFailureKind.DECODE);
                    assertThat(failure.getAttemptedEncodings()).containsExactly("UTF-8", "ISO-8859-1", "windows-1252");
                });
    }

    @Test
    void keepsBlankLinesSoRowNumbersMatchTheFile() {
        byte[] content = "SKU,Name,Selling Price\nA,One,1\n\nB,Two,2\n".getBytes(StandardCharsets.UTF_8);

        DecodedTable table = decoder.decode(content);

        assertThat(table.dataRows()).hasSize(3);
        assertThat(table.dataRows().get(2)).containsExactly("B", "Two", "2");
    }

    @Test
    void unterminatedQuoteIsADecodeFailure() {
        byte[] content = "SKU,Name,Selling Price\nA,\"Broken,1\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode(content)).isInstanceOf(DecodeFailureException.class);
    }

    @Test
    void emptyContentDecodesToEmptyTable() {
        DecodedTable table = decoder.decode(new byte[0]);

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.header()).isEmpty();
    }
}
