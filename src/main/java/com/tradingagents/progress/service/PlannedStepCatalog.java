package com.tradingagents.progress.service;

import com.tradingagents.progress.dto.PlannedStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Standard plan of a stock analysis run. The step names are the module names the
 * pipeline reports, so events map onto steps without any log parsing.
 */
@Component
public class PlannedStepCatalog {

    public static final String PHASE_PREPARATION = "preparation";
    public static final String PHASE_ANALYST = "analyst";
    public static final String PHASE_DEBATE = "debate";
    public static final String PHASE_TRADING = "trading";
    public static final String PHASE_RISK = "risk_assessment";
    public static final String PHASE_POST_PROCESSING = "post_processing";

    static final int DEFAULT_RESEARCH_DEPTH = 2;

    private static final String[][] PREPARATION = {
            {"analysis_start", "Analysis start", "Log the start of the analysis and open the analysis session"},
            {"cost_estimation", "Cost estimation", "Estimate token usage and cost from the selected analysts and research depth"},
            {"data_preparation", "Data preparation", "Validate the symbol and prefetch 30 days of base market data"},
            {"environment_validation", "Environment validation", "Check API keys and required environment variables"},
            {"config_builder", "Build configuration", "Build the LLM provider, model, depth and market configuration"},
            {"symbol_formatting", "Symbol formatting", "Format the symbol for the market of the selected data source"},
            {"graph_initialization", "Engine initialization", "Create the analysis graph with its agents and tool nodes"},
            {"step_output_directory", "Step output directory", "Prepare the directory that stores each step's output"},
    };

    private static final Map<String, String[]> ANALYSTS = Map.of(
            "market", new String[]{"market_analyst", "Market analyst",
                    "Price trend, moving averages, MACD/RSI/KDJ/Bollinger indicators, support, resistance and volume"},
            "fundamentals", new String[]{"fundamentals_analyst", "Fundamentals analyst",
                    "Revenue, profit, cash flow, business model and valuation ratios such as PE, PB and ROE"},
            "news", new String[]{"news_analyst", "News analyst",
                    "Collect relevant news and assess the impact of events, industry moves and policy changes"},
            "social", new String[]{"social_media_analyst", "Social media analyst",
                    "Investor sentiment and discussion heat across social platforms"},
            "risk", new String[]{"risk_analyst", "Risk analyst",
                    "Identify investment risks, grade them and propose controls"},
            "technical", new String[]{"technical_analyst", "Technical analyst",
                    "Chart patterns, technical indicators, support and resistance"},
            "sentiment", new String[]{"sentiment_analyst", "Sentiment analyst",
                    "Market mood, investor psychology and opinion trends"}
    );

    private static final String[][] RISK_DEBATE = {
            {"risky_analyst", "Aggressive risk analyst", "Argue the high-risk, high-return strategy"},
            {"safe_analyst", "Conservative risk analyst", "Argue the risk-controlled strategy"},
            {"neutral_analyst", "Neutral risk analyst", "Argue a balanced strategy"},
            {"risk_manager", "Risk manager", "Weigh the risk views and make the final risk decision and rating"},
    };

    private static final String[][] POST_PROCESSING = {
            {"graph_signal_processing", "Signal processing", "Extract the structured buy/hold/sell decision"},
            {"result_processing", "Result processing", "Collect risk data and token usage and format the results"},
            {"completion_logging", "Completion logging", "Record completion time, total duration and total cost"},
            {"save_results", "Save results", "Persist the analysis results"},
    };

    /**
     * @param analysts        short analyst keys (market, fundamentals, news, social, ...), in run order
     * @param researchDepth   1 quick, 2 standard (adds the research debate), 3 deep (adds the risk debate)
     * @param maxDebateRounds bull/bear rounds before the research manager decides
     */
    public List<PlannedStep> plan(List<String> analysts, Integer researchDepth, Integer maxDebateRounds) {
        int depth = researchDepth != null ? researchDepth : DEFAULT_RESEARCH_DEPTH;
        int rounds = maxDebateRounds != null && maxDebateRounds > 0 ? maxDebateRounds : 1;
        List<PlannedStep> steps = new ArrayList<>();

        for (String[] step : PREPARATION) {
            add(steps, step[0], step[1], step[2], PHASE_PREPARATION, null, null);
        }

        if (analysts != null) {
            for (String analyst : analysts) {
                String[] known = ANALYSTS.get(analyst);
                if (known != null) {
                    add(steps, known[0], known[1], known[2], PHASE_ANALYST, null, null);
                } else {
                    add(steps, analyst, analyst + " analyst", "Specialised " + analyst + " analysis",
                            PHASE_ANALYST, null, null);
                }
            }
        }

        if (depth >= 2) {
            for (int round = 1; round <= rounds; round++) {
                add(steps, "bull_researcher", "Bull researcher", "Make the case for the investment opportunity",
                        PHASE_DEBATE, round, "bull");
                add(steps, "bear_researcher", "Bear researcher", "Make the case against and flag the risks",
                        PHASE_DEBATE, round, "bear");
            }
            add(steps, "research_manager", "Research manager",
                    "Weigh bull and bear views and write the investment plan", PHASE_DEBATE, null, "judge");
        }

        add(steps, "trader", "Trader", "Turn the research into a concrete trading plan", PHASE_TRADING, null, null);

        if (depth >= 3) {
            for (String[] step : RISK_DEBATE) {
                add(steps, step[0], step[1], step[2], PHASE_RISK, null, null);
            }
        } else {
            add(steps, "risk_tip", "Risk notice", "Summarise the main investment risks", PHASE_RISK, null, null);
        }

        for (String[] step : POST_PROCESSING) {
            add(steps, step[0], step[1], step[2], PHASE_POST_PROCESSING, null, null);
        }
        return steps;
    }

    private static void add(List<PlannedStep> steps, String name, String displayName, String description,
                            String phase, Integer round, String role) {
        steps.add(PlannedStep.builder()
                .index(steps.size() + 1)
                .name(name)
                .displayName(displayName)
                .description(description)
                .phase(phase)
                .round(round)
                .role(role)
                .build());
    }
}
