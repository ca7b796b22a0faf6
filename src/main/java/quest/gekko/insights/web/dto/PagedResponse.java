package quest.gekko.insights.web.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

public record PagedResponse<T>(long total, int page, int perPage, int pages, List<T> items) {

    /** Converts a zero-based Spring Data page into the one-based response shape. */
    public static <E, T> PagedResponse<T> from(Page<E> source, Function<E, T> mapper) {
        return new PagedResponse<>(source.getTotalElements(), source.getNumber() + 1, source.getSize(),
                source.getTotalPages(), source.getContent().stream().map(mapper).toList());
    }
}
