package quest.gekko.insights.web.dto;

import java.util.List;

/**
 * A page with optional embedded collections. Collections that were not requested are {@code null}
 * and left out of the JSON.
 */
public record PageDetailDTO(
        CompanyPageDTO page,
        List<PostDTO> posts,
        List<PersonDTO> followers,
        List<PersonDTO> employees
) {}
