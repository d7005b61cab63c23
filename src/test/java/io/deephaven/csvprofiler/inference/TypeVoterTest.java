package io.deephaven.csvprofiler.inference;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.within;

public class TypeVoterTest {
    private static TypeVoter voter(final String name) {
        return new TypeVoter(new SemanticMatcher(name), 10_000, 50);
    }

    @Test
    public void majorityWins() {
        final TypeVoter voter = voter("value");
        voter.vote(PrimitiveType.INTEGER, "1");
        voter.vote(PrimitiveType.INTEGER, "2");
        voter.vote(PrimitiveType.INTEGER, "3");
        voter.vote(PrimitiveType.TEXT, "abc");
        final TypeInference result = voter.result();
        Assertions.assertThat(result.type()).isEqualTo(PrimitiveType.INTEGER);
        Assertions.assertThat(result.confidence()).isEqualTo(0.75);
        Assertions.assertThat(result.votes()).containsEntry(PrimitiveType.TEXT, 1L);
        Assertions.assertThat(result.totalVotes()).isEqualTo(4);
    }

    @Test
    public void noVotesIsUnknown() {
        final TypeInference result = voter("value").result();
        Assertions.assertThat(result.type()).isEqualTo(PrimitiveType.UNKNOWN);
        Assertions.assertThat(result.confidence()).isZero();
    }

    @Test
    public void tiesGoToTheMoreSpecificType() {
        final TypeVoter voter = voter("value");
        voter.vote(PrimitiveType.BOOLEAN, "yes");
        voter.vote(PrimitiveType.DATE, "2024-01-01");
        Assertions.assertThat(voter.result().type()).isEqualTo(PrimitiveType.BOOLEAN);
    }

    @Test
    public void integersWidenToFloat() {
        final TypeVoter voter = voter("value");
        voter.vote(PrimitiveType.INTEGER, "1");
        voter.vote(PrimitiveType.INTEGER, "2");
        voter.vote(PrimitiveType.FLOAT, "2.5");
        voter.vote(PrimitiveType.TEXT, "x");
        final TypeInference result = voter.result();
        Assertions.assertThat(result.type()).isEqualTo(PrimitiveType.FLOAT);
        Assertions.assertThat(result.confidence()).isEqualTo(0.75);
    }

    @Test
    public void fewDistinctTextIsCategorical() {
        final TypeVoter voter = voter("size");
        for (int ii = 0; ii < 10; ++ii) {
            voter.vote(PrimitiveType.TEXT, ii % 2 == 0 ? "small" : "large");
        }
        Assertions.assertThat(voter.result().type()).isEqualTo(PrimitiveType.CATEGORICAL);
    }

    @Test
    public void manyDistinctTextStaysText() {
        final TypeVoter voter = new TypeVoter(new SemanticMatcher("note"), 10_000, 5);
        for (int ii = 0; ii < 20; ++ii) {
            voter.vote(PrimitiveType.TEXT, "note " + (ii % 10));
        }
        Assertions.assertThat(voter.result().type()).isEqualTo(PrimitiveType.TEXT);
    }

    @Test
    public void freezesAfterSampleLimit() {
        final TypeVoter voter = new TypeVoter(new SemanticMatcher("value"), 3, 50);
        voter.vote(PrimitiveType.INTEGER, "1");
        voter.vote(PrimitiveType.INTEGER, "2");
        voter.vote(PrimitiveType.INTEGER, "3");
        Assertions.assertThat(voter.isSettled()).isTrue();
        voter.vote(PrimitiveType.TEXT, "late");
        Assertions.assertThat(voter.totalVotes()).isEqualTo(3);
        Assertions.assertThat(voter.result().confidence()).isEqualTo(1.0);
    }

    @Test
    public void hintNeedsEightyPercent() {
        final TypeVoter voter = voter("contact");
        for (int ii = 0; ii < 7; ++ii) {
            voter.vote(PrimitiveType.TEXT, "user" + ii + "@example.com");
        }
        voter.vote(PrimitiveType.TEXT, "unknown");
        voter.vote(PrimitiveType.TEXT, "n.a.");
        Assertions.assertThat(voter.result().semanticHint()).isNull();
        voter.vote(PrimitiveType.TEXT, "late@example.com");
        voter.vote(PrimitiveType.TEXT, "later@example.com");
        voter.vote(PrimitiveType.TEXT, "latest@example.com");
        final TypeInference result = voter.result();
        Assertions.assertThat(result.semanticHint()).isEqualTo(SemanticHint.EMAIL);
        Assertions.assertThat(result.semanticHintRatio()).isCloseTo(10.0 / 12, within(1e-12));
    }

    @Test
    public void identifierRule() {
        final TypeVoter voter = voter("order_id");
        voter.vote(PrimitiveType.INTEGER, "17");
        voter.vote(PrimitiveType.INTEGER, "18");
        Assertions.assertThat(voter.applyIdentifierRule(voter.result(), true).semanticHint())
                .isEqualTo(SemanticHint.IDENTIFIER);
        Assertions.assertThat(voter.applyIdentifierRule(voter.result(), false).semanticHint()).isNull();
        final TypeVoter other = voter("amount");
        other.vote(PrimitiveType.INTEGER, "17");
        other.vote(PrimitiveType.INTEGER, "18");
        Assertions.assertThat(other.applyIdentifierRule(other.result(), true).semanticHint()).isNull();
    }
}
