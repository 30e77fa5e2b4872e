package com.vnaddress.matching;

import com.vnaddress.gazetteer.AdministrativeLevel;
import com.vnaddress.gazetteer.Gazetteer;
import com.vnaddress.gazetteer.GazetteerLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Works on already normalized text, so every expectation can be traced by hand.
 */
class HierarchicalResolverTest {

    private static Gazetteer gazetteer;
    private static HierarchicalResolver resolver;

    @BeforeAll
    static void setUp() {
        gazetteer = new GazetteerLoader().loadFromClasspath("/gazetteer/vn-sample.json");
        resolver = new HierarchicalResolver(gazetteer);
    }

    @Test
    void testResolvesAllThreeLevels() {
        ResolutionResult result = resolver.resolve("So 10 Duong Le Loi Ben Nghe Q1 Thanh Pho Ho Chi Minh");

        assertThat(result.province()).isEqualTo("Ho Chi Minh");
        assertThat(result.district()).isEqualTo("Quan 1");
        assertThat(result.ward()).isEqualTo("Ben Nghe");
        assertThat(result.remainder()).isEqualTo("So 10 Duong Le Loi");
        assertThat(result.provinceId()).isEqualTo("79");
        assertThat(result.districtId()).isEqualTo("760");
        assertThat(result.wardId()).isEqualTo("26734");
    }

    @Test
    @DisplayName("Only the last occurrence of the province alias is consumed")
    void testSingleOccurrenceRemoval() {
        ResolutionResult result = resolver.resolve("99 Long An Ben Luc Long An");

        assertThat(result.province()).isEqualTo("Long An");
        assertThat(result.district()).isEqualTo("Ben Luc");
        assertThat(result.remainder()).isEqualTo("99 Long An");
    }

    @Test
    @DisplayName("A resolved province restricts districts to its own, with no fallback")
    void testHierarchicalConstraint() {
        // Thu Duc belongs to Ho Chi Minh, not to Long An
        ResolutionResult result = resolver.resolve("12 Tran Phu Thu Duc Long An");

        assertThat(result.province()).isEqualTo("Long An");
        assertThat(result.district()).isEmpty();
        assertThat(result.ward()).isEmpty();
        assertThat(result.isResolved(AdministrativeLevel.DISTRICT)).isFalse();
        assertThat(result.remainder()).isEqualTo("12 Tran Phu Thu Duc");
    }

    @Test
    @DisplayName("Without a province the district is searched everywhere and names its province")
    void testParentInference() {
        ResolutionResult result = resolver.resolve("7 Pasteur Da Kao Q1");

        assertThat(result.district()).isEqualTo("Quan 1");
        assertThat(result.province()).isEqualTo(gazetteer.province("79").orElseThrow().name());
        assertThat(result.ward()).isEqualTo("Da Kao");
        assertThat(result.remainder()).isEqualTo("7 Pasteur");
    }

    @Test
    void testNothingMatches() {
        ResolutionResult result = resolver.resolve("12 Duong So 5 Khu Cong Nghiep");

        assertThat(result.province()).isEmpty();
        assertThat(result.district()).isEmpty();
        assertThat(result.ward()).isEmpty();
        assertThat(result.provinceId()).isNull();
        assertThat(result.remainder()).isEqualTo("12 Duong So 5 Khu Cong Nghiep");
    }

    @Test
    void testEmptyAddress() {
        ResolutionResult result = resolver.resolve("");

        assertThat(result.remainder()).isEmpty();
        assertThat(result.format()).isEqualTo(" , , ");
    }

    @Test
    @DisplayName("Ward alias must end at a terminator, so P1 does not match inside P12")
    void testSpecialEndingAnchorForWards() {
        ResolutionResult result = resolver.resolve("8 Nguyen Kiem P12 Go Vap Tp Ho Chi Minh");

        assertThat(result.district()).isEqualTo("Go Vap");
        assertThat(result.ward()).isEqualTo("Phuong 12");
        assertThat(result.remainder()).isEqualTo("8 Nguyen Kiem");
    }

    @Test
    void testSpecialEndingAnchorRejectsPrefixOfLongerWord() {
        ResolutionResult result = resolver.resolve("5 Tan Phuoc Q7 Ho Chi Minh");

        assertThat(result.district()).isEqualTo("Quan 7");
        assertThat(result.ward()).isEmpty();
        assertThat(result.remainder()).isEqualTo("5 Tan Phuoc");
    }

    @Test
    void testDanglingCityQualifierIsStripped() {
        assertThat(resolver.resolve("45 Le Loi Thanh Pho Ho Chi Minh").remainder()).isEqualTo("45 Le Loi");
        assertThat(resolver.resolve("45 Le Loi Tp Ho Chi Minh").remainder()).isEqualTo("45 Le Loi");
        // only a whole trailing token counts
        assertThat(resolver.resolve("45 Le Loi XTp Ho Chi Minh").remainder()).isEqualTo("45 Le Loi XTp");
        assertThat(resolver.resolve("45 Le Loi\u00a0Tp Ho Chi Minh").remainder()).isEqualTo("45 Le Loi");
    }

    @Test
    void testShortQualifierOnlyWhenConfigured() {
        HierarchicalResolver strict = new HierarchicalResolver(gazetteer,
                ResolverSettings.defaults().withDanglingQualifiers(List.of("Thanh Pho")));

        assertThat(strict.resolve("45 Le Loi Tp Ho Chi Minh").remainder()).isEqualTo("45 Le Loi Tp");
        assertThat(strict.resolve("45 Le Loi Thanh Pho Ho Chi Minh").remainder()).isEqualTo("45 Le Loi");
    }

    @Test
    void testDeterminism() {
        String address = "8 Nguyen Kiem P12 Go Vap Tp Ho Chi Minh";

        assertThat(resolver.resolve(address)).isEqualTo(resolver.resolve(address));
        assertThat(resolver.resolve(address).format()).isEqualTo(resolver.resolve(address).format());
    }

    @Test
    @DisplayName("The alias that occurs furthest right wins")
    void testRightmostMatchWins() {
        HierarchicalResolver tieResolver = new HierarchicalResolver(Gazetteer.builder()
                .province("1", "Alpha", List.of("Alpha"))
                .province("2", "Beta", List.of("Beta"))
                .build());

        assertThat(tieResolver.resolve("Beta Alpha").province()).isEqualTo("Alpha");
        assertThat(tieResolver.resolve("Alpha Beta").province()).isEqualTo("Beta");
    }

    @Test
    @DisplayName("At the same position the longer alias wins, whatever the declaration order")
    void testLongerAliasWinsAtSameIndex() {
        Gazetteer shortFirst = Gazetteer.builder()
                .province("1", "Son", List.of("Son"))
                .province("2", "Son La", List.of("Son La"))
                .build();
        Gazetteer longFirst = Gazetteer.builder()
                .province("2", "Son La", List.of("Son La"))
                .province("1", "Son", List.of("Son"))
                .build();

        ResolutionResult result = new HierarchicalResolver(shortFirst).resolve("12 Son La");

        assertThat(result.province()).isEqualTo("Son La");
        assertThat(result.remainder()).isEqualTo("12");
        assertThat(new HierarchicalResolver(longFirst).resolve("12 Son La").province()).isEqualTo("Son La");
    }

    @Test
    @DisplayName("A full tie goes to the unit declared first")
    void testFullTieGoesToFirstDeclared() {
        Gazetteer kienGiangFirst = Gazetteer.builder()
                .province("91", "Kien Giang", List.of("Kien"))
                .province("92", "Kien Tuong", List.of("Kien"))
                .build();
        Gazetteer kienTuongFirst = Gazetteer.builder()
                .province("92", "Kien Tuong", List.of("Kien"))
                .province("91", "Kien Giang", List.of("Kien"))
                .build();

        assertThat(new HierarchicalResolver(kienGiangFirst).resolve("3 Kien").province()).isEqualTo("Kien Giang");
        assertThat(new HierarchicalResolver(kienTuongFirst).resolve("3 Kien").province()).isEqualTo("Kien Tuong");
    }

    @Test
    @DisplayName("Removal cuts the last plain occurrence of the alias, not the anchored match")
    void testRemovalUsesLastPlainOccurrence() {
        HierarchicalResolver plainRemoval = new HierarchicalResolver(Gazetteer.builder()
                .province("1", "Test", List.of("Test"))
                .district("10", "Quan 1", "1", List.of("Q1"))
                .build());

        ResolutionResult result = plainRemoval.resolve("5 Q1 Le Q10 Test");

        assertThat(result.district()).isEqualTo("Quan 1");
        assertThat(result.remainder()).isEqualTo("5 Q1 Le 0");
    }

    @Test
    void testRegexCharactersInAliasesAreLiteral() {
        HierarchicalResolver literal = new HierarchicalResolver(Gazetteer.builder()
                .province("1", "Test", List.of("Test"))
                .district("10", "Khu (A)", "1", List.of("Khu (A)"))
                .build());

        ResolutionResult result = literal.resolve("5 Khu (A) Test");

        assertThat(result.district()).isEqualTo("Khu (A)");
        assertThat(result.remainder()).isEqualTo("5");
    }

    @Test
    void testLevelMatchOrdering() {
        var unit = gazetteer.province("79").orElseThrow();
        LevelMatch left = new LevelMatch(unit, "Ho Chi Minh", 3);
        LevelMatch right = new LevelMatch(unit, "Hcm", 10);
        LevelMatch longerSameIndex = new LevelMatch(unit, "Hcm City", 10);

        assertThat(left.beats(null)).isTrue();
        assertThat(right.beats(left)).isTrue();
        assertThat(left.beats(right)).isFalse();
        assertThat(longerSameIndex.beats(right)).isTrue();
        assertThat(right.beats(longerSameIndex)).isFalse();
        assertThat(right.beats(new LevelMatch(unit, "Xyz", 10))).isFalse();
    }
}
