package org.smileyface.sitecrawler.crawler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrontierTest {

    @Test
    void poll_returnsEntriesInFifoOrder() {
        Frontier frontier = new Frontier();
        frontier.enqueue(new FrontierEntry("https://e.com/", 0));
        frontier.enqueue(new FrontierEntry("https://e.com/a", 1));
        frontier.enqueue(new FrontierEntry("https://e.com/b", 1));

        assertThat(frontier.poll().url()).isEqualTo("https://e.com/");
        assertThat(frontier.poll().url()).isEqualTo("https://e.com/a");
        assertThat(frontier.poll().url()).isEqualTo("https://e.com/b");
        assertThat(frontier.poll()).isNull();
        assertThat(frontier.isEmpty()).isTrue();
    }

    @Test
    void enqueue_sameUrlTwice_keepsFirstAndShallowest() {
        Frontier frontier = new Frontier();
        assertThat(frontier.enqueue(new FrontierEntry("https://e.com/a", 1))).isTrue();
        assertThat(frontier.enqueue(new FrontierEntry("https://e.com/a", 2))).isFalse();

        assertThat(frontier.size()).isEqualTo(1);
        assertThat(frontier.poll().depth()).isEqualTo(1);
    }

    @Test
    void enqueue_refusesVisitedAndPreviouslyQueuedUrls() {
        Frontier frontier = new Frontier();
        frontier.enqueue(new FrontierEntry("https://e.com/", 0));
        FrontierEntry seed = frontier.poll();
        frontier.markVisited(seed.url());

        assertThat(frontier.enqueue(seed.child("https://e.com/"))).isFalse();
        assertThat(frontier.isVisited("https://e.com/")).isTrue();
        assertThat(frontier.isKnown("https://e.com/")).isTrue();
        assertThat(frontier.isKnown("https://e.com/new")).isFalse();
        assertThat(frontier.visitedCount()).isEqualTo(1);
    }

    @Test
    void child_isOneLevelDeeper() {
        FrontierEntry parent = new FrontierEntry("https://e.com/a", 2);
        assertThat(parent.child("https://e.com/a/b")).isEqualTo(new FrontierEntry("https://e.com/a/b", 3));
    }

    @Test
    void entry_rejectsBlankUrlAndNegativeDepth() {
        assertThatThrownBy(() -> new FrontierEntry(" ", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FrontierEntry("https://e.com/", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
