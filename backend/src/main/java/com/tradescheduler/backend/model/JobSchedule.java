package com.tradescheduler.backend.model;

import java.util.List;

public record JobSchedule(List<String> days, Integer hour, Integer minute) {
}
