package com.example.meetingscheduler.domain.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ConfirmationRequestPayload implements AssistantPayload {

    public enum DraftAction {
        SCHEDULE,
        CHANGE_TIME,
        CANCEL
    }

    private String draftTitle;
    private List<DraftAction> actions = new ArrayList<>();

    public static ConfirmationRequestPayload forDraft(String draftTitle) {
        return new ConfirmationRequestPayload(draftTitle,
                new ArrayList<>(List.of(DraftAction.SCHEDULE, DraftAction.CHANGE_TIME, DraftAction.CANCEL)));
    }
}
