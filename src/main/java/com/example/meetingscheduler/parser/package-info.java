/**
 * Rule-based reading of free-form meeting requests.
 *
 * Every field has an ordered list of independent extraction strategies (see the *Extractors
 * classes). {@link com.example.meetingscheduler.parser.RequestParser} runs them and scores the
 * result with {@link com.example.meetingscheduler.parser.ConfidenceScorer}.
 */
package com.example.meetingscheduler.parser;
