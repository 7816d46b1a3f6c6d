package com.delta.creatorscout.discovery.platform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeedQueriesTest {

    @Test
    void hashtagsComeFirstThenBioWords() {
        assertThat(SeedQueries.derive(
            "natgeo",
            "National Geographic",
            "Exploring #Wildlife and #ocean stories. press@ng.example"
        )).containsExactly("wildlife", "ocean", "exploring");
    }

    @Test
    void stopWordsAndEmailsFallBackToHandle() {
        assertThat(SeedQueries.derive("bob", "Official Channel", "Business inquiries: bob@brews.example"))
            .containsExactly("bob");
    }

    @Test
    void handleIsTheFallbackQuery() {
        assertThat(SeedQueries.derive("@@baristabob ", null, null)).containsExactly("baristabob");
    }
}
