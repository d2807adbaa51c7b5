package io.veraaws.server.core;

import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.FilterSpec;
import io.veraaws.server.spi.Resource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.veraaws.server.core.TestTypes.INSTANCE;
import static io.veraaws.server.core.TestTypes.VPC;
import static org.assertj.core.api.Assertions.assertThat;

class FilterEvaluatorTest {

    private final FilterEvaluator filter = new FilterEvaluator();

    private static Resource instance(String id, String type, String state, Map<String, String> tags, String... groupIds) {
        ValueTree.Mapping.Builder attrs = ValueTree.Mapping.builder().put("instanceType", type);
        if (groupIds.length > 0) {
            ValueTree[] groups = new ValueTree[groupIds.length];
            for (int i = 0; i < groupIds.length; i++) {
                groups[i] = ValueTree.Mapping.builder().put("groupId", groupIds[i]).build();
            }
            attrs.put("groupSet", ValueTree.Sequence.of(groups));
        }
        return new Resource(INSTANCE, id, attrs.build(), tags, Instant.EPOCH, state);
    }

    @Test
    void emptyFilterListMatchesEverything() {
        Resource r = instance("i-1", "t2.micro", "running", Map.of());
        assertThat(filter.evaluate(r, List.of())).isTrue();
        assertThat(filter.evaluateAll(List.of(r), List.of())).containsExactly(r);
    }

    @Test
    void valuesAreOredAndFiltersAreAnded() {
        List<Resource> all = List.of(
                instance("i-1", "t2.micro", "running", Map.of()),
                instance("i-2", "t3.large", "running", Map.of()),
                instance("i-3", "t2.micro", "stopped", Map.of()));

        List<FilterSpec> filters = List.of(
                FilterSpec.of("instance-type", "t2.micro", "t3.large"),
                FilterSpec.of("instance-state-name", "running"));

        assertThat(filter.evaluateAll(all, filters)).extracting(Resource::id).containsExactly("i-1", "i-2");
    }

    @Test
    void wildcardsApplyOnlyWhenPresent() {
        Resource c5 = instance("i-1", "c5.xlarge", "running", Map.of());
        Resource t2 = instance("i-2", "t2.micro", "running", Map.of());

        assertThat(filter.evaluateAll(List.of(c5, t2), List.of(FilterSpec.of("instance-type", "c5*")))).containsExactly(c5);
        assertThat(filter.evaluateAll(List.of(c5, t2), List.of(FilterSpec.of("instance-type", "t2.micr?")))).containsExactly(t2);
        assertThat(filter.evaluate(t2, List.of(FilterSpec.of("instance-type", "t2")))).isFalse();
    }

    @Test
    void tagFiltersSeeCurrentTagValues() {
        Resource r = instance("i-1", "t2.micro", "running", Map.of("env", "prod", "team", "core"));

        assertThat(filter.evaluate(r, List.of(FilterSpec.of("tag:env", "prod")))).isTrue();
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("tag:env", "dev")))).isFalse();
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("tag:missing", "*")))).isFalse();
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("tag-key", "team")))).isTrue();
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("tag-value", "co*")))).isTrue();
    }

    @Test
    void tagKeyIsListedOnceAfterOverwrite() {
        InMemoryResourceStore store = new InMemoryResourceStore(TestTypes.registry());
        Resource vpc = store.create(VPC, ValueTree.Mapping.empty(), Map.of("env", "dev"));
        store.tagResource(vpc.id(), Map.of("env", "prod"));
        Resource updated = store.get(VPC, vpc.id());

        assertThat(filter.evaluate(updated, List.of(FilterSpec.of("tag-key", "env")))).isTrue();
        assertThat(filter.evaluate(updated, List.of(FilterSpec.of("tag:env", "dev")))).isFalse();
        assertThat(filter.evaluate(updated, List.of(FilterSpec.of("tag:env", "prod")))).isTrue();
    }

    @Test
    void unknownFilterNameMatchesNothing() {
        Resource r = instance("i-1", "t2.micro", "running", Map.of());
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("no-such-filter", "*")))).isFalse();
    }

    @Test
    void filterWithoutValuesMatchesNothing() {
        Resource r = instance("i-1", "t2.micro", "running", Map.of());
        assertThat(filter.evaluate(r, List.of(new FilterSpec("instance-type", List.of())))).isFalse();
    }

    @Test
    void sequenceAttributesMatchAnyElement() {
        Resource r = instance("i-1", "t2.micro", "running", Map.of(), "sg-a", "sg-b");

        assertThat(filter.evaluate(r, List.of(FilterSpec.of("instance.group-id", "sg-b")))).isTrue();
        assertThat(filter.evaluate(r, List.of(FilterSpec.of("instance.group-id", "sg-c")))).isFalse();
    }

    @Test
    void pseudoPathsAddressIdAndState() {
        Resource vpc = new Resource(VPC, "vpc-1", ValueTree.Mapping.builder().put("cidrBlock", "10.0.0.0/16").build(),
                Map.of(), Instant.EPOCH, "available");

        assertThat(filter.evaluate(vpc, List.of(FilterSpec.of("vpc-id", "vpc-1")))).isTrue();
        assertThat(filter.evaluate(vpc, List.of(FilterSpec.of("state", "pending")))).isFalse();
        assertThat(filter.evaluate(vpc, List.of(FilterSpec.of("cidr-block", "10.0.*")))).isTrue();
    }
}
