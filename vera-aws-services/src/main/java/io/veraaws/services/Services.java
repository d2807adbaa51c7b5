package io.veraaws.services;

import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ResourceFilter;
import io.veraaws.server.spi.ResourceStore;
import io.veraaws.server.spi.ResourceTypeRegistry;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.services.ec2.DefaultVpc;
import io.veraaws.services.ec2.Ec2ResourceTypes;
import io.veraaws.services.ec2.Ec2Service;
import io.veraaws.services.sts.StsService;

import java.util.ArrayList;
import java.util.List;

/**
 * The services this emulator ships: their definitions, the resource types they store, and the
 * handlers serving them.
 */
public final class Services {

    private Services() {}

    public static List<ServiceDefinition> definitions() {
        return List.of(Ec2Service.DEFINITION, StsService.DEFINITION);
    }

    public static ResourceTypeRegistry resourceTypes() {
        return Ec2ResourceTypes.registry();
    }

    public static List<ActionHandler> handlers(ResourceStore store, ResourceFilter filter) {
        List<ActionHandler> out = new ArrayList<>(Ec2Service.handlers(store, filter));
        out.addAll(StsService.handlers());
        return out;
    }

    /** Seeds the account with its default network. */
    public static void bootstrap(ResourceStore store, String region, String accountId) {
        DefaultVpc.ensure(store, region, accountId);
    }
}
