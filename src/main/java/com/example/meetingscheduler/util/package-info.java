/**
 * Small text helpers shared by the parser and resolver.
 */
package com.example.meetingscheduler.util;
