package com.workplan.planner.api;

import com.workplan.core.model.WeatherSnapshot;

public interface WeatherSource {
    WeatherSnapshot getForecast();
}
