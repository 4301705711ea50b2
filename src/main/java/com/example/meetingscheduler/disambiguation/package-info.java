/**
 * Confirmation of ambiguous participants before a request can move on to slot search.
 */
package com.example.meetingscheduler.disambiguation;
