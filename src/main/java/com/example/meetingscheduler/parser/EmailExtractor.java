package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.util.EmailAddresses;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

class EmailExtractor implements FieldExtractor<List<String>> {

    @Override
    public List<String> extract(String text, LocalDate today) {
        Set<String> emails = new LinkedHashSet<>();
        Matcher matcher = EmailAddresses.EMBEDDED.matcher(text);
        while (matcher.find()) {
            emails.add(matcher.group());
        }
        return emails.isEmpty() ? null : new ArrayList<>(emails);
    }
}
