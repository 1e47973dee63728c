package com.deepansh.research.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TickerExtractorTest {

    @Mock TickerResolver tickerResolver;

    @InjectMocks
    TickerExtractor extractor;

    @Test
    void extract_explicitSymbols_keepsKnownOnesInOrder() {
        assertThat(extractor.extract("Compare TSLA vs AAPL, ignore XYZ and I")).containsExactly("TSLA", "AAPL");
        verify(tickerResolver).resolve("XYZ");
    }

    @Test
    void extract_companyNames_resolveToTickersWithoutLookup() {
        assertThat(extractor.extract("Is Microsoft a better buy than Facebook?")).containsExactly("MSFT", "META");
        verifyNoInteractions(tickerResolver);
    }

    @Test
    void extract_symbolAndNameForSameCompany_deduplicated() {
        assertThat(extractor.extract("Apple (AAPL) earnings")).containsExactly("AAPL");
        verifyNoInteractions(tickerResolver);
    }

    @Test
    void extract_partialWord_isNotACompany() {
        assertThat(extractor.extract("pineapple futures")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        verifyNoInteractions(tickerResolver);
    }

    @Test
    void extract_unknownCompany_usesResolver() {
        when(tickerResolver.resolve("Netflix")).thenReturn(Optional.of("NFLX"));

        assertThat(extractor.extract("Analyze Netflix")).containsExactly("NFLX");
    }

    @Test
    void extract_unknownSymbolAndName_bothResolvedAfterKnownOnes() {
        when(tickerResolver.resolve("IBM")).thenReturn(Optional.of("IBM"));
        when(tickerResolver.resolve("Netflix")).thenReturn(Optional.of("NFLX"));

        assertThat(extractor.extract("What is the IBM outlook vs Netflix and Apple?"))
                .containsExactly("AAPL", "IBM", "NFLX");
        verify(tickerResolver, never()).resolve("Apple");
    }

    @Test
    void extract_unresolvableCandidate_ignored() {
        when(tickerResolver.resolve(anyString())).thenReturn(Optional.empty());

        assertThat(extractor.extract("Tell me about Zorblax Holdings")).isEmpty();
        verify(tickerResolver).resolve("Zorblax Holdings");
    }

    @Test
    void unresolvedCandidates_capitalizedPhrasesSplitAndCapped() {
        assertThat(extractor.unresolvedCandidates("Show Netflix Vs Roku"))
                .containsExactly("Netflix", "Roku");
        assertThat(extractor.unresolvedCandidates("Alpha Beta, Gamma, Delta, Epsilon, Zeta, Eta, Theta"))
                .hasSize(TickerExtractor.MAX_RESOLVED_CANDIDATES);
    }
}
