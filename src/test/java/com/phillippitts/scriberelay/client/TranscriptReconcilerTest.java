package com.phillippitts.scriberelay.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptReconcilerTest {

    @Test
    void stripsOverlapWithCommittedTail() {
        TranscriptReconciler r = new TranscriptReconciler();
        assertThat(r.acceptFinal(null, "the patient reports chest pain")).contains("the patient reports chest pain ");
        assertThat(r.acceptFinal(null, "chest pain since Monday")).contains("since Monday ");
        assertThat(r.transcript()).isEqualTo("the patient reports chest pain since Monday ");
    }

    @Test
    void overlapIsCaseInsensitive() {
        TranscriptReconciler r = new TranscriptReconciler();
        r.acceptFinal(null, "Blood pressure is normal");
        assertThat(r.acceptFinal(null, "NORMAL today")).contains("today ");
    }

    @Test
    void fullyRepeatedTextCommitsNothing() {
        TranscriptReconciler r = new TranscriptReconciler();
        r.acceptFinal(null, "okay thanks");
        assertThat(r.acceptFinal(null, "okay thanks")).isEmpty();
        assertThat(r.transcript()).isEqualTo("okay thanks ");
    }

    @Test
    void duplicateResultIdsAreIgnored() {
        TranscriptReconciler r = new TranscriptReconciler();
        assertThat(r.acceptFinal("r1", "first")).isPresent();
        assertThat(r.acceptFinal("r1", "first again")).isEmpty();
        assertThat(r.acceptFinal("r2", "second")).contains("second ");
    }

    @Test
    void blankTextIsIgnored() {
        TranscriptReconciler r = new TranscriptReconciler();
        assertThat(r.acceptFinal(null, "   ")).isEmpty();
        assertThat(r.acceptFinal(null, null)).isEmpty();
        assertThat(r.transcript()).isEmpty();
    }

    @Test
    void tailIsBoundedByWindow() {
        TranscriptReconciler r = new TranscriptReconciler(10);
        r.acceptFinal(null, "abcdefghijklmnopqrstuvwxyz");
        assertThat(r.tail()).isEqualTo("rstuvwxyz ");
    }

    @Test
    void overlapOlderThanWindowIsKept() {
        TranscriptReconciler r = new TranscriptReconciler(5);
        r.acceptFinal(null, "alpha beta gamma");
        // "beta" left the 5-char window, so it is not treated as a repeat
        assertThat(r.acceptFinal(null, "beta gamma delta")).contains("beta gamma delta ");
    }

    @Test
    void seedPrimesTheWindow() {
        TranscriptReconciler r = new TranscriptReconciler();
        r.seed("earlier words ");
        assertThat(r.acceptFinal(null, "words and more")).contains("and more ");
        assertThat(r.transcript()).isEqualTo("earlier words and more ");
    }

    @Test
    void overlapLengthFindsLongestMatch() {
        assertThat(TranscriptReconciler.overlapLength("go go go ", "go go go now")).isEqualTo(9);
        assertThat(TranscriptReconciler.overlapLength("abc", "xyz")).isZero();
        assertThat(TranscriptReconciler.overlapLength("", "anything")).isZero();
    }

    @Test
    void resetForgetsEverything() {
        TranscriptReconciler r = new TranscriptReconciler();
        r.acceptFinal("id", "text");
        r.reset();
        assertThat(r.transcript()).isEmpty();
        assertThat(r.tail()).isEmpty();
        assertThat(r.acceptFinal("id", "text")).isPresent();
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> new TranscriptReconciler(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
