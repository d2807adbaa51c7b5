package io.veraaws.services.sts;

import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ServiceDefinition;
import io.veraaws.server.spi.ServiceProtocol;

import java.util.List;
import java.util.Set;

public final class StsService {

    public static final String NAME = "sts";

    public static final String NAMESPACE = "https://sts.amazonaws.com/doc/2011-06-15/";

    public static final ServiceDefinition DEFINITION =
            new ServiceDefinition(NAME, ServiceProtocol.QUERY, NAMESPACE, null, Set.of(CallerIdentityHandler.ACTION));

    private StsService() {}

    public static List<ActionHandler> handlers() {
        return List.of(new CallerIdentityHandler());
    }
}
