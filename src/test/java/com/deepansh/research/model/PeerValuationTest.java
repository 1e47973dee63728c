package com.deepansh.research.model;

import com.deepansh.research.provider.ValuationProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PeerValuationTest {

    private static ValuationProfile profile(String ticker, Double pe, Double pb, Double ps) {
        return new ValuationProfile(ticker, "Technology", "Consumer Electronics", pe, pb, ps);
    }

    @Test
    void compare_premiumAgainstPeerAverage() {
        PeerValuation valuation = PeerValuation.compare(
                profile("AAPL", 30.0, 40.0, null),
                List.of(profile("MSFT", 20.0, 10.0, 8.0), profile("GOOGL", 30.0, null, 6.0)));

        assertThat(valuation.sectorAvgPe()).isEqualTo(25.0);
        assertThat(valuation.pePremiumDiscount()).isEqualTo(20.0);
        assertThat(valuation.sectorAvgPb()).isEqualTo(10.0);
        assertThat(valuation.pbPremiumDiscount()).isEqualTo(300.0);
        assertThat(valuation.sectorAvgPs()).isEqualTo(7.0);
        assertThat(valuation.psPremiumDiscount()).isNull();
        assertThat(valuation.peerCount()).isEqualTo(2);
    }

    @Test
    void compare_negativePeerMultiplesIgnored() {
        PeerValuation valuation = PeerValuation.compare(
                profile("TSLA", 60.0, null, null),
                List.of(profile("F", -4.0, null, null)));

        assertThat(valuation.sectorAvgPe()).isNull();
        assertThat(valuation.pePremiumDiscount()).isNull();
    }

    @Test
    void upside_fromMeanTarget() {
        assertThat(AnalystConsensus.upside(220.0, 200.0)).isEqualTo(10.0);
        assertThat(AnalystConsensus.upside(null, 200.0)).isNull();
    }
}
