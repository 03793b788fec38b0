package dev.flyzex.bot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin verdict submitted over the API: {@code approve} or {@code deny}, with
 * an optional note for the applicant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {
    private String decision;
    private String note;
}
