package io.veraaws.services.sts;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ActionHandler;
import io.veraaws.server.spi.ActionResult;
import io.veraaws.server.spi.RequestContext;

import java.util.Set;

/**
 * {@code GetCallerIdentity}: every caller is the account root user.
 */
final class CallerIdentityHandler implements ActionHandler {

    static final String ACTION = "GetCallerIdentity";

    @Override
    public String service() {
        return StsService.NAME;
    }

    @Override
    public Set<String> actions() {
        return Set.of(ACTION);
    }

    @Override
    public ActionResult handle(String action, ValueTree.Mapping params, RequestContext context) {
        if (!ACTION.equals(action)) throw new AwsException.UnsupportedAction(service(), action);
        String account = context.accountId();
        return ActionResult.of(ValueTree.Mapping.builder()
                .put("UserId", account)
                .put("Account", account)
                .put("Arn", "arn:aws:iam::" + account + ":root")
                .build());
    }
}
