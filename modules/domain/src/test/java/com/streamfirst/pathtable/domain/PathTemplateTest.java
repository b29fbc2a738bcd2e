package com.streamfirst.pathtable.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathTemplateTest {

    private static final PathTemplate REVENUE =
        PathTemplate.compile("/data/{country}/{company}/{year:int}_revenue.json");

    @Test
    void testCompileExposesPlaceholdersInOrder() {
        assertThat(REVENUE.placeholderNames()).containsExactly("country", "company", "year");
        assertThat(REVENUE.placeholders()).containsExactly(
            new Placeholder("country", PlaceholderType.STRING),
            new Placeholder("company", PlaceholderType.STRING),
            new Placeholder("year", PlaceholderType.INTEGER));
        assertEquals("/data/", REVENUE.globPrefix());
        assertEquals("/data", REVENUE.rootDirectory());
    }

    @Test
    void testMatchExtractsTypedValues() {
        Optional<KeyBinding> binding = REVENUE.match("/data/France/OVH/2021_revenue.json");

        assertTrue(binding.isPresent(), "Conforming path should match");
        assertEquals(KeyBinding.of("country", "France", "company", "OVH", "year", 2021L), binding.get());
    }

    @Test
    void testMatchRejectsNonConformingPaths() {
        assertThat(REVENUE.match("/data/France/OVH/twenty_revenue.json")).isEmpty();
        assertThat(REVENUE.match("/data/France/OVH/2021_revenue.json.bak")).isEmpty();
        assertThat(REVENUE.match("/data/France/Sub/OVH/2021_revenue.json")).isEmpty();
        assertThat(REVENUE.match("data/France/OVH/2021_revenue.json")).isEmpty();
    }

    @Test
    void testLiteralsAreMatchedVerbatim() {
        PathTemplate template = PathTemplate.compile("/reports (v1.0)/{name}.*+?.json");

        assertThat(template.match("/reports (v1.0)/q1.*+?.json")).contains(KeyBinding.of("name", "q1"));
        assertThat(template.match("/reports Xv1Y0)/q1.*+?.json")).isEmpty();
    }

    @Test
    void testIntegerPlaceholderAcceptsSignsAndRadixPrefixes() {
        PathTemplate template = PathTemplate.compile("/n/{value:d}");

        assertThat(template.match("/n/-42")).contains(KeyBinding.of("value", -42L));
        assertThat(template.match("/n/+7")).contains(KeyBinding.of("value", 7L));
        assertThat(template.match("/n/0x1F")).contains(KeyBinding.of("value", 31L));
        assertThat(template.match("/n/0o17")).contains(KeyBinding.of("value", 15L));
        assertThat(template.match("/n/0b101")).contains(KeyBinding.of("value", 5L));
        assertThat(template.match("/n/1.5")).isEmpty();
    }

    @Test
    void testIntegerOverflowDoesNotMatch() {
        PathTemplate template = PathTemplate.compile("/n/{value:int}");

        assertThat(template.match("/n/9223372036854775807")).contains(KeyBinding.of("value", Long.MAX_VALUE));
        assertThat(template.match("/n/9223372036854775808")).isEmpty();
    }

    @Test
    void testFloatPlaceholderAcceptsGeneralNumbers() {
        PathTemplate template = PathTemplate.compile("/f/{ratio:float}.json");

        assertThat(template.match("/f/0.25.json")).contains(KeyBinding.of("ratio", 0.25));
        assertThat(template.match("/f/-1e3.json")).contains(KeyBinding.of("ratio", -1000.0));
        assertThat(template.match("/f/3.json")).contains(KeyBinding.of("ratio", 3.0));
        assertThat(template.match("/f/abc.json")).isEmpty();
    }

    @Test
    void testFloatPlaceholderAcceptsNanAndInfinityInAnyCase() {
        PathTemplate template = PathTemplate.compile("/f/{ratio:float}.json");

        assertThat(template.match("/f/nan.json")).contains(KeyBinding.of("ratio", Double.NaN));
        assertThat(template.match("/f/NaN.json")).contains(KeyBinding.of("ratio", Double.NaN));
        assertThat(template.match("/f/inf.json")).contains(KeyBinding.of("ratio", Double.POSITIVE_INFINITY));
        assertThat(template.match("/f/-INF.json")).contains(KeyBinding.of("ratio", Double.NEGATIVE_INFINITY));
        assertThat(template.match("/f/+Infinity.json")).contains(KeyBinding.of("ratio", Double.POSITIVE_INFINITY));
        assertThat(template.match("/f/info.json")).isEmpty();
    }

    @Test
    void testBuildFormatsCanonically() {
        KeyBinding binding = KeyBinding.of("country", "France", "company", "OVH", "year", 2021);

        assertEquals("/data/France/OVH/2021_revenue.json", REVENUE.build(binding));
        assertEquals("/f/0.5", PathTemplate.compile("/f/{x:g}").build(KeyBinding.of("x", 0.5)));
    }

    @Test
    void testBuildIgnoresExtraEntries() {
        KeyBinding binding = KeyBinding.of("country", "France", "company", "OVH", "year", 2021L)
            .with("unrelated", "value");

        assertEquals("/data/France/OVH/2021_revenue.json", REVENUE.build(binding));
    }

    @Test
    void testBuildThenMatchRoundTrips() {
        List<KeyBinding> bindings = List.of(
            KeyBinding.of("country", "France", "company", "OVH", "year", 2021L),
            KeyBinding.of("country", "Côte d'Ivoire", "company", "A B.C", "year", -3L),
            KeyBinding.of("country", "x", "company", "y", "year", Long.MIN_VALUE));

        for (KeyBinding binding : bindings) {
            assertThat(REVENUE.match(REVENUE.build(binding))).contains(binding);
        }
    }

    @Test
    void testBuildFailsOnMissingPlaceholder() {
        assertThatThrownBy(() -> REVENUE.build(KeyBinding.of("country", "France", "company", "OVH")))
            .isInstanceOf(MissingKeyException.class)
            .satisfies(e -> assertEquals("year", ((MissingKeyException) e).getPlaceholder()));
    }

    @Test
    void testBuildFailsOnTypeMismatch() {
        KeyBinding binding = KeyBinding.of("country", "France", "company", "OVH", "year", "2021");

        assertThatThrownBy(() -> REVENUE.build(binding))
            .isInstanceOf(TypeMismatchException.class)
            .satisfies(e -> {
                TypeMismatchException mismatch = (TypeMismatchException) e;
                assertEquals("year", mismatch.getPlaceholder());
                assertEquals(PlaceholderType.INTEGER, mismatch.getExpected());
            });
    }

    @Test
    void testBuildRejectsStringsThatCannotBeMatchedBack() {
        assertThatThrownBy(() -> REVENUE.build(KeyBinding.of("country", "a/b", "company", "OVH", "year", 1L)))
            .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> REVENUE.build(KeyBinding.of("country", "", "company", "OVH", "year", 1L)))
            .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void testDoubledBracesAreLiterals() {
        PathTemplate template = PathTemplate.compile("/raw/{{x}}/{name}");

        assertThat(template.placeholderNames()).containsExactly("name");
        assertEquals("/raw/{x}/", template.globPrefix());
        assertThat(template.match("/raw/{x}/abc")).contains(KeyBinding.of("name", "abc"));
        assertEquals("/raw/{x}/abc", template.build(KeyBinding.of("name", "abc")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/data/{country}/{country}.json",
        "/data/{year:date}.json",
        "/data/{country",
        "/data/country}.json",
        "/data/{a{b}}.json",
        "/data/{}.json",
        "/data/{1abc}.json",
        ""
    })
    void testMalformedTemplatesAreRejected(String template) {
        assertThatThrownBy(() -> PathTemplate.compile(template)).isInstanceOf(TemplateException.class);
    }

    @Test
    void testTypeAliases() {
        PathTemplate template = PathTemplate.compile("/{a:str}/{b:s}/{c:integer}/{d:f}/{e:string}");

        assertThat(template.placeholders()).extracting(Placeholder::type).containsExactly(
            PlaceholderType.STRING, PlaceholderType.STRING, PlaceholderType.INTEGER,
            PlaceholderType.FLOAT, PlaceholderType.STRING);
    }

    @Test
    void testTemplateWithoutPlaceholders() {
        PathTemplate template = PathTemplate.compile("/config/settings.json");

        assertThat(template.placeholderNames()).isEmpty();
        assertEquals("/config/settings.json", template.globPrefix());
        assertThat(template.match("/config/settings.json")).contains(KeyBinding.empty());
        assertEquals("/config/settings.json", template.build(KeyBinding.empty()));
    }

    @Test
    void testListingPrefixExtendsThroughBoundStrings() {
        assertEquals("/data/", REVENUE.listingPrefix(KeyBinding.empty()));
        assertEquals("/data/France/", REVENUE.listingPrefix(KeyBinding.of("country", "France")));
        assertEquals("/data/France/OVH/",
            REVENUE.listingPrefix(KeyBinding.of("country", "France", "company", "OVH", "year", 2021L)));
        assertEquals("/data/", REVENUE.listingPrefix(KeyBinding.of("company", "OVH")));
    }

    @Test
    void testTemplatesAreEqualBySource() {
        assertEquals(PathTemplate.compile("/a/{b}"), PathTemplate.compile("/a/{b}"));
        assertEquals("/a/{b}", PathTemplate.compile("/a/{b}").source());
    }
}
