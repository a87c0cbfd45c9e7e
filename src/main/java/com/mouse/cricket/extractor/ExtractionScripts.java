package com.mouse.cricket.extractor;

import com.mouse.cricket.enums.SnapshotKind;

/**
 * Page-side extraction functions, evaluated with {@code page.evaluate}.
 * Each returns a plain object (or null when its container is missing).
 */
final class ExtractionScripts {

    private ExtractionScripts() {}

    static final String MATCH_LIST = """
            () => Array.from(document.querySelectorAll('.match-card')).map(card => ({
                id: card.getAttribute('data-match-id') || '',
                teams: card.querySelector('.teams')?.textContent?.trim() || '',
                format: card.querySelector('.format')?.textContent?.trim() || '',
                dateTime: card.querySelector('.date-time')?.textContent?.trim() || '',
                url: card.querySelector('a')?.getAttribute('href') || ''
            }))
            """;

    static final String MATCH_STATUS = """
            () => document.querySelector('.match-status')?.textContent?.trim() || ''
            """;

    static final String MATCH_INFO = """
            () => {
                const container = document.querySelector('[class*="info"]');
                if (!container) return null;
                const text = sel => document.querySelector(sel)?.textContent?.trim() || '';
                return {
                    teams: {
                        home: text('.team-home, .teamA, .team1, .team-left'),
                        away: text('.team-away, .teamB, .team2, .team-right')
                    },
                    matchDetails: {
                        series: text('.series-name, .series'),
                        format: text('.match-format, .format'),
                        venue: text('.venue-name, .venue'),
                        date: text('.match-date, .date'),
                        time: text('.match-time, .time'),
                        toss: text('.toss-result, .toss'),
                        umpires: Array.from(document.querySelectorAll('.umpire, .umpires'))
                            .map(el => el.textContent?.trim() || '')
                    }
                };
            }
            """;

    static final String SQUADS = """
            () => {
                const container = document.querySelector('[class*="squad"]');
                if (!container) return null;
                const players = teamSelector => Array.from(container.querySelectorAll(
                        `${teamSelector} .player, ${teamSelector} .player-row, ${teamSelector} .player-item`))
                    .map(p => ({
                        name: p.querySelector('.player-name')?.textContent?.trim() || p.textContent?.trim() || '',
                        role: p.querySelector('.player-role')?.textContent?.trim() || '',
                        isCaptain: !!p.querySelector('.captain-indicator, .captain'),
                        isWicketkeeper: !!p.querySelector('.wicketkeeper-indicator, .wicketkeeper')
                    }));
                const name = sel => container.querySelector(sel)?.textContent?.trim() || '';
                return {
                    homeTeam: {
                        name: name('.home-team-name, .teamA, .team1, .team-left'),
                        players: players('.home-team-squad, .teamA, .team1, .team-left')
                    },
                    awayTeam: {
                        name: name('.away-team-name, .teamB, .team2, .team-right'),
                        players: players('.away-team-squad, .teamB, .team2, .team-right')
                    }
                };
            }
            """;

    static final String LIVE = """
            () => {
                const c = document.querySelector('[class*="live"]');
                if (!c) return null;
                const text = sel => c.querySelector(sel)?.textContent?.trim() || '';
                const cell = (el, sel) => el.querySelector(sel)?.textContent?.trim() || '';
                return {
                    currentInnings: text('.current-innings'),
                    score: text('.current-score, .score'),
                    runRate: text('.run-rate'),
                    requiredRunRate: text('.required-run-rate'),
                    lastWicket: text('.last-wicket'),
                    recentBalls: Array.from(c.querySelectorAll('.recent-ball')).map(el => el.textContent?.trim() || ''),
                    partnership: text('.current-partnership'),
                    batsmen: Array.from(c.querySelectorAll('.batsman, .batsman-row')).map(el => ({
                        name: cell(el, '.batsman-name') || el.textContent?.trim() || '',
                        runs: cell(el, '.batsman-runs'),
                        balls: cell(el, '.batsman-balls'),
                        fours: cell(el, '.batsman-fours'),
                        sixes: cell(el, '.batsman-sixes'),
                        strikeRate: cell(el, '.batsman-strike-rate')
                    })),
                    bowlers: Array.from(c.querySelectorAll('.bowler, .bowler-row')).map(el => ({
                        name: cell(el, '.bowler-name') || el.textContent?.trim() || '',
                        overs: cell(el, '.bowler-overs'),
                        maidens: cell(el, '.bowler-maidens'),
                        runs: cell(el, '.bowler-runs'),
                        wickets: cell(el, '.bowler-wickets'),
                        economy: cell(el, '.bowler-economy')
                    })),
                    matchStatus: text('.match-status, .status'),
                    commentary: Array.from(c.querySelectorAll('.commentary-item, .commentary-row')).map(el => ({
                        text: cell(el, '.commentary-text') || el.textContent?.trim() || '',
                        over: cell(el, '.commentary-over'),
                        timestamp: cell(el, '.commentary-timestamp')
                    })).slice(0, 10)
                };
            }
            """;

    static final String SCORECARD = """
            () => {
                const c = document.querySelector('[class*="scorecard"]');
                if (!c) return null;
                const cell = (el, sel) => el.querySelector(sel)?.textContent?.trim() || '';
                const innings = [];
                for (let i = 1; i <= 4; i++) {
                    const el = c.querySelector(`.innings-${i}`);
                    if (!el) continue;
                    innings.push({
                        team: cell(el, '.innings-team'),
                        totalScore: cell(el, '.innings-total'),
                        overs: cell(el, '.innings-overs'),
                        extras: cell(el, '.innings-extras'),
                        batsmen: Array.from(el.querySelectorAll('.batsman-row')).map(row => ({
                            name: cell(row, '.batsman-name') || row.textContent?.trim() || '',
                            dismissal: cell(row, '.batsman-dismissal'),
                            runs: cell(row, '.batsman-runs'),
                            balls: cell(row, '.batsman-balls'),
                            fours: cell(row, '.batsman-fours'),
                            sixes: cell(row, '.batsman-sixes'),
                            strikeRate: cell(row, '.batsman-strike-rate')
                        })),
                        bowlers: Array.from(el.querySelectorAll('.bowler-row')).map(row => ({
                            name: cell(row, '.bowler-name') || row.textContent?.trim() || '',
                            overs: cell(row, '.bowler-overs'),
                            maidens: cell(row, '.bowler-maidens'),
                            runs: cell(row, '.bowler-runs'),
                            wickets: cell(row, '.bowler-wickets'),
                            economy: cell(row, '.bowler-economy')
                        })),
                        fallOfWickets: Array.from(el.querySelectorAll('.fow-item')).map(item => item.textContent?.trim() || '')
                    });
                }
                return {
                    innings,
                    matchSummary: c.querySelector('.match-summary')?.textContent?.trim() || '',
                    playerOfTheMatch: c.querySelector('.player-of-match')?.textContent?.trim() || ''
                };
            }
            """;

    static String forKind(SnapshotKind kind) {
        return switch (kind) {
            case INFO -> MATCH_INFO;
            case SQUADS -> SQUADS;
            case LIVE -> LIVE;
            case SCORECARD -> SCORECARD;
        };
    }
}
