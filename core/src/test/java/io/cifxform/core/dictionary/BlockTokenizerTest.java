package io.cifxform.core.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.cifxform.core.dictionary.BlockTokenizer.Token;
import io.cifxform.core.dictionary.BlockTokenizer.Type;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockTokenizerTest {

    @Test
    void tagsValuesAndLoops() {
        List<Token> tokens = BlockTokenizer.tokenize("_a.b  value  # comment\nloop_ _c.d 'x y' \"it's\"\n");

        assertThat(tokens)
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(Type.TAG, "_a.b"),
                        tuple(Type.VALUE, "value"),
                        tuple(Type.LOOP, "loop_"),
                        tuple(Type.TAG, "_c.d"),
                        tuple(Type.VALUE, "x y"),
                        tuple(Type.VALUE, "it's"));
    }

    @Test
    void textFieldsAndTripleQuotes() {
        List<Token> tokens =
                BlockTokenizer.tokenize("_a.b\n;\nline one\nline two\n;\n_c.d '''\ntriple\n'''\n_e.f [1 {2 3}]\n");

        assertThat(tokens).extracting(Token::text)
                .containsExactly("_a.b", "line one\nline two", "_c.d", "triple", "_e.f", "[1 {2 3}]");
        assertThat(tokens.get(1).quoted()).isTrue();
    }

    @Test
    void quoteFollowedByTextDoesNotClose() {
        List<Token> tokens = BlockTokenizer.tokenize("_a.b 'don't stop' _c.d");

        assertThat(tokens).extracting(Token::text).containsExactly("_a.b", "don't stop", "_c.d");
    }

    @Test
    void saveBlocksAreSplitAndTextFieldsProtected() {
        String text = String.join(
                "\n",
                "data_X",
                "save_first",
                "_a.b 1",
                ";",
                "save_not_a_block",
                ";",
                "save_",
                "save_second",
                "_c.d 2",
                "save_third",
                "_e.f 3",
                "save_");

        List<SaveBlockReader.SaveBlock> blocks = SaveBlockReader.read(text);

        assertThat(blocks).extracting(SaveBlockReader.SaveBlock::name).containsExactly("first", "second", "third");
        assertThat(blocks.get(0).body()).contains("save_not_a_block");
        assertThat(blocks.get(1).body()).isEqualTo("_c.d 2\n");
    }
}
