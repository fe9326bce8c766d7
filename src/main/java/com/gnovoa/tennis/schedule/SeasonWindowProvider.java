package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.model.League;

/** Season-window collaborator: bounds the dates auto-scheduling may pick for a league. */
public interface SeasonWindowProvider {
    SeasonWindow window(League league);
}
