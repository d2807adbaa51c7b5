package io.veraaws.services.ec2;

import io.veraaws.core.ValueTree;
import io.veraaws.server.core.FilterEvaluator;
import io.veraaws.server.core.InMemoryResourceStore;
import io.veraaws.server.core.ParameterDecoder;
import io.veraaws.server.core.RandomHexIdGenerator;
import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.ServiceProtocol;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers over a real store, evaluator and decoder; requests are given as flat query pairs.
 */
final class Ec2Fixture {

    static final String REGION = "us-east-1";
    static final String ACCOUNT = "123456789012";
    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    final InMemoryResourceStore store = new InMemoryResourceStore(
            Ec2ResourceTypes.registry(), new RandomHexIdGenerator(), Clock.fixed(NOW, ZoneOffset.UTC));
    final FilterEvaluator filter = new FilterEvaluator();

    private final ParameterDecoder decoder = new ParameterDecoder(ServiceProtocol.EC2);
    private final Map<String, ActionHandler> handlers = new HashMap<>();

    Ec2Fixture() {
        for (ActionHandler h : Ec2Service.handlers(store, filter)) {
            for (String action : h.actions()) handlers.put(action, h);
        }
    }

    Ec2Fixture withDefaultVpc() {
        DefaultVpc.ensure(store, REGION, ACCOUNT);
        return this;
    }

    ValueTree.Mapping call(String action, String... pairs) {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            raw.computeIfAbsent(pairs[i], k -> new ArrayList<>()).add(pairs[i + 1]);
        }
        RequestContext context = new RequestContext("req-1", Ec2Service.NAME, action, REGION, ACCOUNT, NOW);
        return handlers.get(action).handle(action, decoder.decode(raw), context).body();
    }

    static List<ValueTree.Mapping> items(ValueTree.Mapping body, String set) {
        List<ValueTree.Mapping> out = new ArrayList<>();
        for (ValueTree item : body.sequence(set)) out.add((ValueTree.Mapping) item);
        return out;
    }

    static String text(ValueTree.Mapping body, String... path) {
        ValueTree.Mapping current = body;
        for (int i = 0; i < path.length - 1; i++) current = current.mapping(path[i]).orElseThrow();
        return current.text(path[path.length - 1]).orElseThrow();
    }

    String createVpc(String cidr) {
        return text(call("CreateVpc", "CidrBlock", cidr), "vpc", "vpcId");
    }

    String createSubnet(String vpcId, String cidr) {
        return text(call("CreateSubnet", "VpcId", vpcId, "CidrBlock", cidr), "subnet", "subnetId");
    }

    String createGroup(String vpcId, String name) {
        return text(call("CreateSecurityGroup", "VpcId", vpcId, "GroupName", name, "GroupDescription", name), "groupId");
    }

    String runInstance(String... extra) {
        List<String> pairs = new ArrayList<>(List.of("ImageId", "ami-12345678", "MinCount", "1", "MaxCount", "1"));
        pairs.addAll(List.of(extra));
        ValueTree.Mapping body = call("RunInstances", pairs.toArray(new String[0]));
        return items(body, "instancesSet").get(0).text("instanceId").orElseThrow();
    }
}
