package com.example.meetingscheduler.service;

import com.example.meetingscheduler.domain.model.MeetingDraft;
import com.example.meetingscheduler.domain.model.MeetingPriority;
import com.example.meetingscheduler.domain.model.ParsedRequest;
import com.example.meetingscheduler.domain.model.ParticipantIdentity;
import com.example.meetingscheduler.domain.model.TimeSlotCandidate;

import java.util.List;

/**
 * Builds a {@link MeetingDraft} from the parsed request, the confirmed participants and a chosen slot.
 */
public final class MeetingDraftFactory {

    static final int MAX_NAMED_IN_TITLE = 4;

    private MeetingDraftFactory() {
    }

    public static MeetingDraft create(ParsedRequest request, List<ParticipantIdentity> participants,
                                      TimeSlotCandidate slot, int durationMinutes) {
        MeetingDraft draft = new MeetingDraft();
        for (ParticipantIdentity participant : participants) {
            draft.addParticipant(participant);
        }
        List<String> names = draft.getParticipants().stream().map(MeetingDraftFactory::nameOf).toList();

        String title = request != null ? request.getTitle() : null;
        draft.setTitle(title != null && !title.isBlank() ? title : generateTitle(names));
        String description = request != null ? request.getDescription() : null;
        draft.setDescription(description != null ? description : "Meeting with " + String.join(", ", names));
        MeetingPriority priority = request != null ? request.getPriorityMentioned() : null;
        draft.setPriority(priority != null ? priority : MeetingPriority.MEDIUM);
        draft.setDurationMinutes(durationMinutes);
        draft.setStartTime(slot.startDateTime());
        return draft;
    }

    /**
     * "Meeting with A", "Meeting with A and B", "Meeting with A, B, and C", and for larger groups
     * "Team Meeting (N participants)".
     */
    public static String generateTitle(List<String> names) {
        if (names.isEmpty()) {
            return "Meeting";
        }
        if (names.size() == 1) {
            return "Meeting with " + names.get(0);
        }
        if (names.size() == 2) {
            return "Meeting with " + names.get(0) + " and " + names.get(1);
        }
        if (names.size() <= MAX_NAMED_IN_TITLE) {
            String head = String.join(", ", names.subList(0, names.size() - 1));
            return "Meeting with " + head + ", and " + names.get(names.size() - 1);
        }
        return "Team Meeting (" + names.size() + " participants)";
    }

    private static String nameOf(ParticipantIdentity participant) {
        String name = participant.getDisplayName();
        return name == null || name.isBlank() ? participant.getEmail() : name;
    }
}
