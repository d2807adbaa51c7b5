package io.veraaws.server.spi;

import io.veraaws.core.AwsException;
import io.veraaws.core.Protocol;
import io.veraaws.core.ValueTree;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@code MaxResults} / {@code NextToken} paging over an already filtered result list.
 *
 * <p>Tokens are opaque to clients; they encode the offset of the next page.
 */
public final class Pagination {
    private static final String TOKEN_PREFIX = "offset:";

    private Pagination() {}

    public record Page<T>(List<T> items, Optional<String> nextToken) {}

    public static <T> Page<T> page(List<T> all, ValueTree.Mapping params) {
        Optional<Integer> maxResults = Params.integer(params, Protocol.P_MAX_RESULTS);
        Optional<String> token = Params.text(params, Protocol.P_NEXT_TOKEN);
        if (maxResults.isEmpty() && token.isEmpty()) return new Page<>(all, Optional.empty());

        int start = token.map(Pagination::decode).orElse(0);
        if (start > all.size()) {
            throw AwsException.MalformedParameter.invalidValue(Protocol.P_NEXT_TOKEN, token.get());
        }
        int size = maxResults.orElse(Integer.MAX_VALUE);
        if (size < 1) {
            throw AwsException.MalformedParameter.invalidValue(Protocol.P_MAX_RESULTS, Integer.toString(size));
        }
        int end = (int) Math.min((long) start + size, all.size());
        Optional<String> next = end < all.size() ? Optional.of(encode(end)) : Optional.empty();
        return new Page<>(all.subList(start, end), next);
    }

    static String encode(int offset) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((TOKEN_PREFIX + offset).getBytes(StandardCharsets.UTF_8));
    }

    static int decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            if (!raw.startsWith(TOKEN_PREFIX)) throw new IllegalArgumentException("bad prefix");
            int offset = Integer.parseInt(raw.substring(TOKEN_PREFIX.length()));
            if (offset < 0) throw new IllegalArgumentException("negative offset");
            return offset;
        } catch (IllegalArgumentException e) {
            throw AwsException.MalformedParameter.invalidValue(Protocol.P_NEXT_TOKEN, token);
        }
    }
}
