package io.veraaws.server.core;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.ServiceProtocol;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterDecoderTest {

    private final ParameterDecoder ec2 = new ParameterDecoder(ServiceProtocol.EC2);

    private static Map<String, List<String>> raw(String... pairs) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.computeIfAbsent(pairs[i], k -> new ArrayList<>()).add(pairs[i + 1]);
        }
        return out;
    }

    @Test
    void rebuildsNestedFilters() {
        ValueTree.Mapping params = ec2.decode(raw(
                "Filter.1.Name", "instance-type",
                "Filter.1.Value.1", "t2.micro",
                "Filter.1.Value.2", "t3.micro",
                "Filter.2.Name", "tag:env",
                "Filter.2.Value.1", "prod"));

        ValueTree.Mapping first = (ValueTree.Mapping) params.sequence("Filter").get(0);
        assertThat(first.text("Name")).contains("instance-type");
        assertThat(first.sequence("Value")).containsExactly(ValueTree.of("t2.micro"), ValueTree.of("t3.micro"));
        assertThat(params.sequence("Filter")).hasSize(2);
    }

    @Test
    void resultDoesNotDependOnArrivalOrder() {
        List<String> pairs = List.of(
                "VpcId.2", "vpc-b", "VpcId.1", "vpc-a",
                "Filter.1.Value.1", "x", "Filter.1.Name", "n",
                "DryRun", "false", "VpcId.10", "vpc-j",
                "VpcId.3", "vpc-c", "VpcId.4", "vpc-d", "VpcId.5", "vpc-e", "VpcId.6", "vpc-f",
                "VpcId.7", "vpc-g", "VpcId.8", "vpc-h", "VpcId.9", "vpc-i");
        ValueTree.Mapping expected = ec2.decode(raw(pairs.toArray(new String[0])));

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < pairs.size(); i += 2) order.add(i);
        for (long seed = 0; seed < 20; seed++) {
            Collections.shuffle(order, new Random(seed));
            List<String> shuffled = new ArrayList<>();
            for (int i : order) {
                shuffled.add(pairs.get(i));
                shuffled.add(pairs.get(i + 1));
            }
            assertThat(ec2.decode(raw(shuffled.toArray(new String[0])))).isEqualTo(expected);
        }
        assertThat(Params.texts(expected, "VpcId")).hasSize(10).endsWith("vpc-i", "vpc-j");
    }

    @Test
    void repeatedKeyKeepsLastValue() {
        ValueTree.Mapping params = ec2.decode(raw("CidrBlock", "10.0.0.0/16", "CidrBlock", "10.1.0.0/16"));
        assertThat(params.text("CidrBlock")).contains("10.1.0.0/16");
    }

    @Test
    void valueAndStructureAtSamePathIsMalformed() {
        assertThatThrownBy(() -> ec2.decode(raw("Filter.1.Name", "a", "Filter.1.Name.1", "b")))
                .isInstanceOf(AwsException.MalformedParameter.class);
        assertThatThrownBy(() -> ec2.decode(raw("Filter.1.Name.1", "b", "Filter.1.Name", "a")))
                .isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void listAndMappingAtSamePathIsMalformed() {
        assertThatThrownBy(() -> ec2.decode(raw("Tag.1.Key", "a", "Tag.Key", "b")))
                .isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void gapsAndZeroIndicesAreMalformed() {
        assertThatThrownBy(() -> ec2.decode(raw("VpcId.1", "a", "VpcId.3", "c")))
                .isInstanceOf(AwsException.MalformedParameter.class)
                .hasMessageContaining("VpcId.2");
        assertThatThrownBy(() -> ec2.decode(raw("VpcId.0", "a")))
                .isInstanceOf(AwsException.MalformedParameter.class);
        assertThatThrownBy(() -> ec2.decode(raw("VpcId.01", "a")))
                .isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void emptySegmentIsMalformed() {
        assertThatThrownBy(() -> ec2.decode(raw("Filter..Name", "a")))
                .isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void sparseIndicesAllowedWhenProtocolSaysSo() {
        ServiceProtocol lenient = new ServiceProtocol("lenient", ServiceProtocol.RequestEncoding.QUERY,
                "text/xml", ServiceProtocol.MemberCase.PASCAL, "member", "member", true, ServiceProtocol.Envelope.QUERY);
        ValueTree.Mapping params = new ParameterDecoder(lenient).decode(raw("Id.1", "a", "Id.5", "e"));
        assertThat(params.sequence("Id")).containsExactly(ValueTree.of("a"), ValueTree.of("e"));
    }

    @Test
    void queryProtocolDropsMemberAndEntryMarkers() {
        ParameterDecoder query = new ParameterDecoder(ServiceProtocol.QUERY);
        ValueTree.Mapping params = query.decode(raw(
                "Tags.member.1.Key", "env",
                "Tags.member.1.Value", "prod",
                "Attributes.entry.1.key", "k"));

        ValueTree.Mapping tag = (ValueTree.Mapping) params.sequence("Tags").get(0);
        assertThat(tag.text("Key")).contains("env");
        assertThat(params.sequence("Attributes")).hasSize(1);
    }

    @Test
    void memberIsAnOrdinaryNameForEc2() {
        ValueTree.Mapping params = ec2.decode(raw("Group.member", "x"));
        assertThat(params.mapping("Group").flatMap(g -> g.text("member"))).contains("x");
    }
}
