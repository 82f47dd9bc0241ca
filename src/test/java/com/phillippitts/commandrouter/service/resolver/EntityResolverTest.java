package com.phillippitts.commandrouter.service.resolver;

import com.phillippitts.commandrouter.config.properties.ResolverProperties;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EntityResolverTest {

    private final EntityResolver resolver = new EntityResolver(ResolverProperties.defaults());

    private static ImmutableCandidateDirectory contacts(String... labelValuePairs) {
        Map<String, CanonicalEntry> aliases = new LinkedHashMap<>();
        for (int i = 0; i < labelValuePairs.length; i += 2) {
            aliases.put(labelValuePairs[i], new CanonicalEntry(labelValuePairs[i], labelValuePairs[i + 1]));
        }
        return ImmutableCandidateDirectory.of("contacts", aliases);
    }

    @Test
    void exactMatchIgnoresCaseAndWhitespace() {
        ImmutableCandidateDirectory dir = contacts("Jay", "+919321781905");

        Resolution r = resolver.resolve("  JAY ", dir);

        assertThat(r.isFound()).isTrue();
        assertThat(r.tier()).isEqualTo(Resolution.MatchTier.EXACT);
        assertThat(r.entry().value()).isEqualTo("+919321781905");
    }

    @Test
    void stripsTrailingContextWordBeforeMatching() {
        ImmutableCandidateDirectory dir = ImmutableCandidateDirectory.of("contacts",
                Map.of("shivam", new CanonicalEntry("Shivam Patel", "+911111111111")));

        Resolution r = resolver.resolve("Shivam clg", dir);

        assertThat(r.tier()).isEqualTo(Resolution.MatchTier.CONTEXT_STRIPPED);
        assertThat(r.entry().label()).isEqualTo("Shivam Patel");
    }

    @Test
    void contextStrippedQueryFallsThroughToPartialMatch() {
        ImmutableCandidateDirectory dir = contacts("Shivam Patel", "+911111111111");

        Resolution r = resolver.resolve("Shivam clg", dir);

        assertThat(r.tier()).isEqualTo(Resolution.MatchTier.PARTIAL);
        assertThat(r.entry().label()).isEqualTo("Shivam Patel");
    }

    @Test
    void stripsRepeatedContextWords() {
        assertThat(resolver.stripContextWords(List.of("priya", "mam", "college")))
                .containsExactly("priya");
    }

    @Test
    void neverStripsTheWholeQuery() {
        assertThat(resolver.stripContextWords(List.of("bro"))).containsExactly("bro");
    }

    @Test
    void literalPrefixOfAnAliasMatches() {
        ImmutableCandidateDirectory dir = contacts("shivam patel", "+10000000002");

        Resolution r = resolver.resolve("shiv", dir);

        assertThat(r.tier()).isEqualTo(Resolution.MatchTier.PARTIAL);
        assertThat(r.entry().value()).isEqualTo("+10000000002");
    }

    @Test
    void substringInsideAnAliasMatches() {
        ImmutableCandidateDirectory dir = contacts("Vijay Sharma", "+919876543211");

        assertThat(resolver.resolve("jay", dir).entry().label()).isEqualTo("Vijay Sharma");
        assertThat(resolver.resolve("vijay", dir).entry().label()).isEqualTo("Vijay Sharma");
    }

    @Test
    void aliasInsideLongerQueryMatches() {
        ImmutableCandidateDirectory dir = contacts("Mom", "+919876543212");

        Resolution r = resolver.resolve("my mom please", dir);

        assertThat(r.tier()).isEqualTo(Resolution.MatchTier.PARTIAL);
        assertThat(r.entry().label()).isEqualTo("Mom");
    }

    @Test
    void shortestLabelWinsTieByDefault() {
        ImmutableCandidateDirectory dir = contacts("Priya Sharma", "+911", "Priya Verma", "+912");

        Resolution r = resolver.resolve("priya", dir);

        assertThat(r.entry().label()).isEqualTo("Priya Verma");
    }

    @Test
    void alphabeticalPolicyBreaksTieByLabel() {
        EntityResolver alphabetical = new EntityResolver(new ResolverProperties(null, TieBreakPolicy.ALPHABETICAL));
        ImmutableCandidateDirectory dir = contacts("Priya Verma", "+912", "Priya Sharma", "+911");

        Resolution r = alphabetical.resolve("priya", dir);

        assertThat(r.entry().label()).isEqualTo("Priya Sharma");
    }

    @Test
    void resolutionIsIdempotent() {
        ImmutableCandidateDirectory dir = ImmutableCandidateDirectory.of("contacts",
                Map.of("shivam", new CanonicalEntry("Shivam Patel", "+911111111111")));

        Resolution first = resolver.resolve("shivam clg", dir);
        Resolution second = resolver.resolve(first.entry().label(), dir);

        assertThat(second.entry()).isEqualTo(first.entry());
        assertThat(second.tier()).isEqualTo(Resolution.MatchTier.EXACT);
    }

    @Test
    void blankOrUnknownQueryIsNotFound() {
        ImmutableCandidateDirectory dir = contacts("Jay", "+919321781905");

        assertThat(resolver.resolve(null, dir).isFound()).isFalse();
        assertThat(resolver.resolve("   ", dir).isFound()).isFalse();
        Resolution unknown = resolver.resolve("Zed", dir);
        assertThat(unknown.isFound()).isFalse();
        assertThat(unknown.query()).isEqualTo("Zed");
        assertThat(unknown.tier()).isEqualTo(Resolution.MatchTier.NONE);
    }

    @Test
    void emptyDirectoryNeverMatches() {
        assertThat(resolver.resolve("jay", ImmutableCandidateDirectory.empty("contacts")).isFound()).isFalse();
    }

    @Test
    void overlapWorksInEitherDirection() {
        assertThat(EntityResolver.overlaps("shivam patel", "shiv")).isTrue();
        assertThat(EntityResolver.overlaps("mom", "call my mom")).isTrue();
        assertThat(EntityResolver.overlaps("priya", "jay")).isFalse();
        assertThat(EntityResolver.overlaps("priya", "")).isFalse();
    }
}
