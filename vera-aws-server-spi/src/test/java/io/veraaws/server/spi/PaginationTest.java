package io.veraaws.server.spi;

import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginationTest {

    private static final List<String> ITEMS = List.of("a", "b", "c", "d", "e");

    @Test
    void withoutPagingParametersEverythingIsReturned() {
        Pagination.Page<String> page = Pagination.page(ITEMS, ValueTree.Mapping.empty());
        assertThat(page.items()).isEqualTo(ITEMS);
        assertThat(page.nextToken()).isEmpty();
    }

    @Test
    void tokensWalkThroughAllPages() {
        Pagination.Page<String> first = Pagination.page(ITEMS, ValueTree.Mapping.builder().put("MaxResults", "2").build());
        assertThat(first.items()).containsExactly("a", "b");
        assertThat(first.nextToken()).isPresent();

        Pagination.Page<String> second = Pagination.page(ITEMS, ValueTree.Mapping.builder()
                .put("MaxResults", "2")
                .put("NextToken", first.nextToken().get())
                .build());
        assertThat(second.items()).containsExactly("c", "d");

        Pagination.Page<String> last = Pagination.page(ITEMS, ValueTree.Mapping.builder()
                .put("MaxResults", "2")
                .put("NextToken", second.nextToken().get())
                .build());
        assertThat(last.items()).containsExactly("e");
        assertThat(last.nextToken()).isEmpty();
    }

    @Test
    void garbageTokenIsInvalidParameterValue() {
        ValueTree.Mapping params = ValueTree.Mapping.builder().put("NextToken", "not-a-token").build();
        assertThatThrownBy(() -> Pagination.page(ITEMS, params))
                .isInstanceOfSatisfying(AwsException.MalformedParameter.class,
                        e -> assertThat(e.errorCode()).isEqualTo("InvalidParameterValue"));
    }

    @Test
    void tokenPastTheEndIsRejected() {
        ValueTree.Mapping params = ValueTree.Mapping.builder().put("NextToken", Pagination.encode(9)).build();
        assertThatThrownBy(() -> Pagination.page(ITEMS, params)).isInstanceOf(AwsException.MalformedParameter.class);
    }

    @Test
    void nonPositiveMaxResultsIsRejected() {
        ValueTree.Mapping params = ValueTree.Mapping.builder().put("MaxResults", "0").build();
        assertThatThrownBy(() -> Pagination.page(ITEMS, params)).isInstanceOf(AwsException.MalformedParameter.class);
    }
}
