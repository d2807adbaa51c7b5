package io.veraaws.services.ec2;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.Params;
import io.veraaws.server.spi.RequestContext;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static io.veraaws.services.ec2.Ec2ResourceTypes.SECURITY_GROUP;
import static io.veraaws.services.ec2.Ec2ResourceTypes.VPC;

final class SecurityGroupHandler extends Ec2ActionHandler {

    static final String DEFAULT_GROUP = "default";

    private static final int MAX_NAME_LENGTH = 255;

    private final Object lock = new Object();

    SecurityGroupHandler(ResourceStore store, ResourceFilter filter) {
        super(store, filter, "CreateSecurityGroup", "DescribeSecurityGroups", "DeleteSecurityGroup",
                "AuthorizeSecurityGroupIngress", "RevokeSecurityGroupIngress");
    }

    @Override
    protected ActionResult dispatch(String action, ValueTree.Mapping params, RequestContext context) {
        return switch (action) {
            case "CreateSecurityGroup" -> create(params, context);
            case "DescribeSecurityGroups" -> describe(params);
            case "DeleteSecurityGroup" -> delete(params);
            case "AuthorizeSecurityGroupIngress" -> authorize(params, context);
            case "RevokeSecurityGroupIngress" -> revoke(params, context);
            default -> throw new AwsException.UnsupportedAction(service(), action);
        };
    }

    private ActionResult create(ValueTree.Mapping params, RequestContext context) {
        String name = Params.require(params, "GroupName");
        String description = Params.require(params, "GroupDescription");
        if (name.length() > MAX_NAME_LENGTH) throw AwsException.MalformedParameter.invalidValue("GroupName", name);
        if (name.equalsIgnoreCase(DEFAULT_GROUP)) {
            throw new AwsException.ValidationFailed("InvalidGroup.Reserved",
                    "The security group '" + name + "' is reserved");
        }
        if (name.startsWith("sg-")) {
            throw new AwsException.MalformedParameter("Group names may not be in the format sg-*.");
        }
        Map<String, String> tags = Params.tagSpecifications(params, SECURITY_GROUP.name());
        String vpcId = Params.text(params, "VpcId").orElseGet(() -> DefaultVpc.find(store).map(Resource::id)
                .orElseThrow(() -> new AwsException.ValidationFailed("VPCIdNotSpecified", "No default VPC for this user")));

        Resource group;
        synchronized (lock) {
            store.get(VPC, vpcId);
            if (findByName(store, vpcId, name).isPresent()) {
                throw new AwsException.ValidationFailed("InvalidGroup.Duplicate",
                        "The security group '" + name + "' already exists for VPC '" + vpcId + "'");
            }
            Params.checkDryRun(params);
            group = store.create(SECURITY_GROUP, attributes(name, description, vpcId, context.accountId()), tags);
        }
        return ActionResult.of(ValueTree.Mapping.builder()
                .put("return", true)
                .put("groupId", group.id())
                .put("tagSet", tagSet(group))
                .build());
    }

    private ActionResult describe(ValueTree.Mapping params) {
        List<Resource> groups = select(SECURITY_GROUP, params, "GroupId");
        List<String> names = Params.texts(params, "GroupName");
        if (!names.isEmpty()) {
            List<Resource> named = new ArrayList<>();
            for (String name : new LinkedHashSet<>(names)) {
                Resource match = groups.stream()
                        .filter(g -> name.equals(g.attribute("groupName").orElse(null)))
                        .findFirst()
                        .orElseThrow(() -> new AwsException.NotFound(SECURITY_GROUP.notFoundCode(), "security group", name));
                named.add(match);
            }
            groups = named;
        }
        return page(groups, params, "securityGroupInfo", SecurityGroupHandler::render);
    }

    private ActionResult delete(ValueTree.Mapping params) {
        Resource group = resolve(params);
        if (isDefaultGroup(group)) {
            throw new AwsException.ValidationFailed("CannotDelete",
                    "the specified group: \"" + group.id() + "\" name: \"default\" cannot be deleted by a user");
        }
        Params.checkDryRun(params);
        store.delete(SECURITY_GROUP, group.id());
        return ActionResult.ok();
    }

    private ActionResult authorize(ValueTree.Mapping params, RequestContext context) {
        Resource group = resolve(params);
        List<Permission> requested = requested(params, group, context.accountId());
        Params.checkDryRun(params);
        store.update(SECURITY_GROUP, group.id(), e -> {
            Map<String, Permission> current = Permission.index(e.attributes().sequence("ipPermissions"));
            for (Permission add : requested) {
                Permission target = current.computeIfAbsent(add.key(), k -> add.emptyCopy());
                for (Map.Entry<String, ValueTree.Mapping> source : add.sources.entrySet()) {
                    if (target.sources.containsKey(source.getKey())) {
                        throw new AwsException.ValidationFailed("InvalidPermission.Duplicate",
                                "the specified rule \"peer: " + Permission.peer(source.getKey()) + ", " + add.describe()
                                        + ", ALLOW\" already exists");
                    }
                    target.sources.put(source.getKey(), source.getValue());
                }
            }
            e.set("ipPermissions", Permission.toTree(current.values()));
        });
        return ActionResult.ok();
    }

    private ActionResult revoke(ValueTree.Mapping params, RequestContext context) {
        Resource group = resolve(params);
        List<Permission> requested = requested(params, group, context.accountId());
        Params.checkDryRun(params);
        store.update(SECURITY_GROUP, group.id(), e -> {
            Map<String, Permission> current = Permission.index(e.attributes().sequence("ipPermissions"));
            for (Permission remove : requested) {
                Permission target = current.get(remove.key());
                for (String source : remove.sources.keySet()) {
                    if (target == null || target.sources.remove(source) == null) {
                        throw new AwsException.ValidationFailed("InvalidPermission.NotFound",
                                "The specified rule does not exist in this security group.");
                    }
                }
                if (target != null && target.sources.isEmpty()) current.remove(remove.key());
            }
            e.set("ipPermissions", Permission.toTree(current.values()));
        });
        return ActionResult.ok();
    }

    /** Group named by {@code GroupId}, or by {@code GroupName} in the default VPC. */
    private Resource resolve(ValueTree.Mapping params) {
        Optional<String> id = Params.text(params, "GroupId");
        if (id.isPresent()) return store.get(SECURITY_GROUP, id.get());
        String name = Params.text(params, "GroupName").orElseThrow(() -> AwsException.MalformedParameter.missing("GroupId"));
        String vpcId = DefaultVpc.find(store).map(Resource::id).orElse(null);
        return findByName(store, vpcId, name)
                .orElseThrow(() -> new AwsException.NotFound(SECURITY_GROUP.notFoundCode(), "security group", name));
    }

    private List<Permission> requested(ValueTree.Mapping params, Resource group, String accountId) {
        List<ValueTree.Mapping> specs = Params.mappings(params, "IpPermissions");
        List<Permission> out = new ArrayList<>();
        if (specs.isEmpty()) {
            // flat form: IpProtocol, FromPort, ToPort, CidrIp, SourceSecurityGroupName
            Permission p = Permission.of(Params.require(params, "IpProtocol"),
                    Params.integer(params, "FromPort").orElse(null), Params.integer(params, "ToPort").orElse(null));
            Params.text(params, "CidrIp").ifPresent(c -> p.addCidr(c, null));
            Params.text(params, "SourceSecurityGroupId").ifPresent(g -> p.addGroup(store.get(SECURITY_GROUP, g).id(), accountId));
            Params.text(params, "SourceSecurityGroupName").ifPresent(n -> p.addGroup(byName(group, n).id(), accountId));
            out.add(p);
        }
        for (ValueTree.Mapping spec : specs) {
            Permission p = Permission.of(Params.require(spec, "IpProtocol"),
                    Params.integer(spec, "FromPort").orElse(null), Params.integer(spec, "ToPort").orElse(null));
            for (ValueTree.Mapping range : Params.mappings(spec, "IpRanges")) {
                p.addCidr(Params.require(range, "CidrIp"), Params.text(range, "Description").orElse(null));
            }
            for (ValueTree.Mapping range : Params.mappings(spec, "Ipv6Ranges")) {
                p.addIpv6(Params.require(range, "CidrIpv6"));
            }
            for (ValueTree.Mapping pair : Params.mappings(spec, "Groups")) {
                Optional<String> gid = Params.text(pair, "GroupId");
                String resolved = gid.isPresent()
                        ? store.get(SECURITY_GROUP, gid.get()).id()
                        : byName(group, Params.require(pair, "GroupName")).id();
                p.addGroup(resolved, Params.text(pair, "UserId").orElse(accountId));
            }
            out.add(p);
        }
        for (Permission p : out) {
            if (p.sources.isEmpty()) throw AwsException.MalformedParameter.missing("IpPermissions.1.IpRanges");
        }
        return out;
    }

    private Resource byName(Resource group, String name) {
        String vpcId = group.attribute("vpcId").orElse(null);
        return findByName(store, vpcId, name)
                .orElseThrow(() -> new AwsException.NotFound(SECURITY_GROUP.notFoundCode(), "security group", name));
    }

    static Optional<Resource> findByName(ResourceStore store, String vpcId, String name) {
        if (vpcId == null) return Optional.empty();
        for (Resource g : store.list(SECURITY_GROUP)) {
            if (vpcId.equals(g.attribute("vpcId").orElse(null)) && name.equals(g.attribute("groupName").orElse(null))) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    static boolean isDefaultGroup(Resource group) {
        return DEFAULT_GROUP.equals(group.attribute("groupName").orElse(null));
    }

    /** Creates the VPC's {@code default} group: ingress from itself, egress anywhere. */
    static Resource createDefaultGroup(ResourceStore store, String vpcId, String accountId) {
        Resource group = store.create(SECURITY_GROUP,
                attributes(DEFAULT_GROUP, "default VPC security group", vpcId, accountId), Map.of());
        Permission self = Permission.of("-1", null, null);
        self.addGroup(group.id(), accountId);
        return store.update(SECURITY_GROUP, group.id(), e -> e.set("ipPermissions", Permission.toTree(List.of(self))));
    }

    private static ValueTree.Mapping attributes(String name, String description, String vpcId, String accountId) {
        Permission egress = Permission.of("-1", null, null);
        egress.addCidr("0.0.0.0/0", null);
        return ValueTree.Mapping.builder()
                .put("ownerId", accountId)
                .put("groupName", name)
                .put("groupDescription", description)
                .put("vpcId", vpcId)
                .put("ipPermissions", new ValueTree.Sequence(List.of()))
                .put("ipPermissionsEgress", Permission.toTree(List.of(egress)))
                .build();
    }

    static ValueTree render(Resource group) {
        return render(group, "groupId").build();
    }

    /**
     * One permission entry: protocol and port range with its sources keyed by {@code cidr:},
     * {@code ipv6:} or {@code group:}.
     */
    static final class Permission {
        private static final Map<String, String> PROTOCOLS = Map.of(
                "tcp", "tcp", "6", "tcp", "udp", "udp", "17", "udp", "icmp", "icmp", "1", "icmp", "-1", "-1", "all", "-1");

        final String protocol;
        final Integer fromPort;
        final Integer toPort;
        final Map<String, ValueTree.Mapping> sources = new LinkedHashMap<>();

        private Permission(String protocol, Integer fromPort, Integer toPort) {
            this.protocol = protocol;
            this.fromPort = fromPort;
            this.toPort = toPort;
        }

        static Permission of(String rawProtocol, Integer fromPort, Integer toPort) {
            String protocol = normalize(rawProtocol);
            if (protocol.equals("-1")) return new Permission(protocol, null, null);
            if (protocol.equals("tcp") || protocol.equals("udp")) {
                if (fromPort == null) throw AwsException.MalformedParameter.missing("FromPort");
                if (toPort == null) throw AwsException.MalformedParameter.missing("ToPort");
                checkRange("FromPort", fromPort, 0, 65535);
                checkRange("ToPort", toPort, 0, 65535);
                if (fromPort > toPort) throw AwsException.MalformedParameter.invalidValue("FromPort", fromPort.toString());
            } else if (protocol.equals("icmp")) {
                if (fromPort != null) checkRange("FromPort", fromPort, -1, 255);
                if (toPort != null) checkRange("ToPort", toPort, -1, 255);
            }
            return new Permission(protocol, fromPort, toPort);
        }

        private static String normalize(String raw) {
            String p = raw.toLowerCase(Locale.ROOT);
            String known = PROTOCOLS.get(p);
            if (known != null) return known;
            if (p.matches("\\d{1,3}") && Integer.parseInt(p) <= 255) return Integer.toString(Integer.parseInt(p));
            throw AwsException.MalformedParameter.invalidValue("IpProtocol", raw);
        }

        private static void checkRange(String parameter, int value, int min, int max) {
            if (value < min || value > max) throw AwsException.MalformedParameter.invalidValue(parameter, Integer.toString(value));
        }

        void addCidr(String cidr, String description) {
            Cidr parsed = Cidr.parse("CidrIp", cidr);
            sources.put("cidr:" + parsed, ValueTree.Mapping.builder()
                    .put("cidrIp", parsed.toString())
                    .put("description", description)
                    .build());
        }

        void addIpv6(String cidr) {
            sources.put("ipv6:" + cidr.toLowerCase(Locale.ROOT), ValueTree.Mapping.builder()
                    .put("cidrIpv6", cidr.toLowerCase(Locale.ROOT))
                    .build());
        }

        void addGroup(String groupId, String userId) {
            sources.put("group:" + groupId, ValueTree.Mapping.builder()
                    .put("groupId", groupId)
                    .put("userId", userId)
                    .build());
        }

        String key() {
            return protocol + "|" + fromPort + "|" + toPort;
        }

        Permission emptyCopy() {
            return new Permission(protocol, fromPort, toPort);
        }

        String describe() {
            if (protocol.equals("-1")) return "ALL";
            return protocol.toUpperCase(Locale.ROOT) + ", from port: " + fromPort + ", to port: " + toPort;
        }

        static String peer(String sourceKey) {
            return sourceKey.substring(sourceKey.indexOf(':') + 1);
        }

        static Map<String, Permission> index(List<ValueTree> stored) {
            Map<String, Permission> out = new LinkedHashMap<>();
            for (ValueTree item : stored) {
                if (!(item instanceof ValueTree.Mapping m)) continue;
                Permission p = new Permission(m.text("ipProtocol").orElse("-1"),
                        m.text("fromPort").map(Integer::valueOf).orElse(null),
                        m.text("toPort").map(Integer::valueOf).orElse(null));
                for (ValueTree r : m.sequence("ipRanges")) {
                    if (r instanceof ValueTree.Mapping range) p.sources.put("cidr:" + range.text("cidrIp").orElse(""), range);
                }
                for (ValueTree r : m.sequence("ipv6Ranges")) {
                    if (r instanceof ValueTree.Mapping range) p.sources.put("ipv6:" + range.text("cidrIpv6").orElse(""), range);
                }
                for (ValueTree r : m.sequence("groups")) {
                    if (r instanceof ValueTree.Mapping pair) p.sources.put("group:" + pair.text("groupId").orElse(""), pair);
                }
                out.put(p.key(), p);
            }
            return out;
        }

        static ValueTree.Sequence toTree(Iterable<Permission> permissions) {
            List<ValueTree> out = new ArrayList<>();
            for (Permission p : permissions) {
                List<ValueTree> cidrs = new ArrayList<>();
                List<ValueTree> ipv6 = new ArrayList<>();
                List<ValueTree> groups = new ArrayList<>();
                for (Map.Entry<String, ValueTree.Mapping> s : p.sources.entrySet()) {
                    if (s.getKey().startsWith("cidr:")) cidrs.add(s.getValue());
                    else if (s.getKey().startsWith("ipv6:")) ipv6.add(s.getValue());
                    else groups.add(s.getValue());
                }
                ValueTree.Mapping.Builder b = ValueTree.Mapping.builder().put("ipProtocol", p.protocol);
                if (p.fromPort != null) b.put("fromPort", p.fromPort.longValue());
                if (p.toPort != null) b.put("toPort", p.toPort.longValue());
                out.add(b.put("groups", new ValueTree.Sequence(groups))
                        .put("ipRanges", new ValueTree.Sequence(cidrs))
                        .put("ipv6Ranges", new ValueTree.Sequence(ipv6))
                        .build());
            }
            return new ValueTree.Sequence(out);
        }
    }
}
