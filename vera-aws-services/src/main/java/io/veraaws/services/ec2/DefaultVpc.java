package io.veraaws.services.ec2;

import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.Resource;
import io.veraaws.server.spi.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The account's default VPC: {@value #CIDR} with one default {@code /20} subnet per availability
 * zone and an attached internet gateway.
 */
public final class DefaultVpc {

    private static final Logger log = LoggerFactory.getLogger(DefaultVpc.class);

    static final String CIDR = "172.31.0.0/16";
    private static final int SUBNET_PREFIX = 20;

    private static final Object LOCK = new Object();

    private DefaultVpc() {}

    public static Optional<Resource> find(ResourceStore store) {
        for (Resource vpc : store.list(Ec2ResourceTypes.VPC)) {
            if (vpc.attribute("isDefault").map(Boolean::parseBoolean).orElse(false)) return Optional.of(vpc);
        }
        return Optional.empty();
    }

    /** Default subnet of the default VPC in {@code zone}, or its first default subnet when {@code zone} is null. */
    static Optional<Resource> subnet(ResourceStore store, String zone) {
        Optional<Resource> vpc = find(store);
        if (vpc.isEmpty()) return Optional.empty();
        for (Resource subnet : store.list(Ec2ResourceTypes.SUBNET)) {
            if (!subnet.attribute("vpcId").orElse("").equals(vpc.get().id())) continue;
            if (!subnet.attribute("defaultForAz").map(Boolean::parseBoolean).orElse(false)) continue;
            if (zone == null || zone.equals(subnet.attribute("availabilityZone").orElse(null))) return Optional.of(subnet);
        }
        return Optional.empty();
    }

    /** Creates the default VPC unless one exists; returns the existing or new VPC. */
    public static Resource ensure(ResourceStore store, String region, String accountId) {
        synchronized (LOCK) {
            Optional<Resource> existing = find(store);
            return existing.orElseGet(() -> create(store, region, accountId));
        }
    }

    /**
     * @return the new VPC, or empty when a default VPC already exists
     */
    static Optional<Resource> createIfAbsent(ResourceStore store, String region, String accountId) {
        synchronized (LOCK) {
            if (find(store).isPresent()) return Optional.empty();
            return Optional.of(create(store, region, accountId));
        }
    }

    private static Resource create(ResourceStore store, String region, String accountId) {
        Cidr cidr = Cidr.parse("cidrBlock", CIDR);
        Resource vpc = VpcHandler.createVpc(store, cidr, "default", true, accountId, Map.of());

        List<RegionCatalog.Zone> zones = RegionCatalog.zones(region);
        long step = 1L << (32 - SUBNET_PREFIX);
        for (int i = 0; i < zones.size(); i++) {
            Cidr subnetCidr = new Cidr(cidr.network() + i * step, SUBNET_PREFIX);
            SubnetHandler.createSubnet(store, vpc.id(), subnetCidr, zones.get(i), true, accountId, Map.of());
        }

        ValueTree.Mapping attachment = ValueTree.Mapping.builder()
                .put("vpcId", vpc.id())
                .put("state", "available")
                .build();
        Resource igw = InternetGatewayHandler.createGateway(store, accountId, Map.of());
        store.update(Ec2ResourceTypes.INTERNET_GATEWAY, igw.id(), e -> e.set("attachmentSet", ValueTree.Sequence.of(attachment)));

        log.info("Created default VPC {} ({}) in {}", vpc.id(), CIDR, region);
        return vpc;
    }
}
