package com.example.pokebattle.tools;

import com.example.pokebattle.combat.BattleResult;
import com.example.pokebattle.combat.TurnRecord;
import com.example.pokebattle.config.BattleConfig;
import com.example.pokebattle.error.PokemonBattleException;
import com.example.pokebattle.persistence.DataLoader;
import com.example.pokebattle.persistence.PokemonDAO;
import com.example.pokebattle.service.BattleSimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one battle from the command line and logs the result via SLF4J.
 *
 * Usage: BattleRunner pokemon1 pokemon2 [--brief]
 */
public class BattleRunner {
    private static final Logger logger = LoggerFactory.getLogger(BattleRunner.class);

    public static void main(String[] args) {
        if (args.length < 2) {
            logger.error("Usage: BattleRunner <pokemon1> <pokemon2> [--brief]");
            System.exit(2);
        }
        boolean detailed = !(args.length > 2 && "--brief".equals(args[2]));
        System.exit(run(args[0], args[1], detailed, BattleConfig.load()));
    }

    /**
     * @return process exit code, 0 on success
     */
    static int run(String pokemon1, String pokemon2, boolean detailed, BattleConfig config) {
        try {
            PokemonDAO dao = new PokemonDAO(config.getDbUrl());
            DataLoader.loadDefaults(dao);
            BattleSimulationService service = BattleSimulationService.fromConfig(config, dao);

            BattleResult result = service.simulateBattle(pokemon1, pokemon2, detailed);
            for (TurnRecord turn : result.getTurns()) {
                logger.info("--- Turn {} ---", turn.turn());
                for (String action : turn.actions()) {
                    logger.info("  {}", action);
                }
            }
            logger.info("{}", result.getBattleSummary());
            return 0;
        } catch (PokemonBattleException e) {
            logger.error("Battle failed ({}): {}", e.getErrorType(), e.getMessage());
            return 1;
        }
    }
}
