package com.trade.gateway.tools;

import com.trade.gateway.TradeGateway;
import com.trade.gateway.auth.Credentials;
import com.trade.gateway.core.AccountConfig;
import com.trade.gateway.core.ConfigManager;
import com.trade.gateway.core.InstrumentSpec;
import com.trade.gateway.core.Symbol;
import com.trade.gateway.exchange.ExchangeAdapter;
import com.trade.gateway.exchange.ExchangeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Connectivity and account-mode diagnostics: configuration (keys masked), account
 * mode, USDT balance and contract specs for the given symbols.
 * <p>
 * Usage: AccountModeCheck [SYMBOL...], defaults to BTC ETH SOL.
 */
public class AccountModeCheck {

    public static void main(String[] args) {
        ConfigManager config = ConfigManager.getInstance();
        List<Symbol> symbols = new ArrayList<>();
        for (String arg : args.length == 0 ? new String[]{"BTC", "ETH", "SOL"} : args) {
            symbols.add(Symbol.of(arg));
        }

        try (TradeGateway gateway = TradeGateway.create(config)) {
            ExchangeAdapter adapter = gateway.client().getAdapter();
            printConfig(config, adapter);

            boolean ok = checkAccount(gateway);
            ok &= checkBalance(gateway);
            checkSpecs(gateway, symbols);

            System.out.println(ok ? "\nAccount ready for perpetual swap trading." : "\nAccount checks failed, see above.");
            if (!ok) {
                System.exit(1);
            }
        }
    }

    private static void printConfig(ConfigManager config, ExchangeAdapter adapter) {
        String prefix = adapter.getName().toLowerCase(Locale.ROOT);
        System.out.println("Exchange:   " + adapter.getName() + (adapter.isDemo() ? " (demo)" : ""));
        System.out.println("Base URL:   " + adapter.getBaseUrl());
        System.out.println("API key:    " + Credentials.mask(config.getProperty(prefix + ".api.key", null)));
        System.out.println("Secret:     " + (config.hasProperty(prefix + ".secret.key") ? "set" : "MISSING"));
        System.out.println("Passphrase: " + (config.hasProperty(prefix + ".passphrase") ? "set" : "not set"));
        System.out.println("Transports: " + config.getProperty("transport.chain", "direct"));
    }

    private static boolean checkAccount(TradeGateway gateway) {
        try {
            AccountConfig accountConfig = gateway.account().getAccountConfig();
            System.out.println("\nAccount level: " + accountConfig.accountLevel()
                    + ", position mode: " + accountConfig.positionMode()
                    + ", uid: " + accountConfig.userId());
            if (!accountConfig.supportsDerivatives()) {
                System.out.println("  This account mode cannot trade perpetual swaps.");
                System.out.println("  Switch to single-currency or multi-currency margin mode in the exchange settings.");
                return false;
            }
            return true;
        } catch (ExchangeException e) {
            System.out.println("\nAccount config query failed: " + e.describe());
            return false;
        }
    }

    private static boolean checkBalance(TradeGateway gateway) {
        try {
            System.out.println("Balance: " + gateway.account().getBalance("USDT"));
            return true;
        } catch (ExchangeException e) {
            System.out.println("Balance query failed: " + e.describe());
            return false;
        }
    }

    private static void checkSpecs(TradeGateway gateway, List<Symbol> symbols) {
        System.out.println("\nContract specs:");
        for (Symbol symbol : symbols) {
            try {
                InstrumentSpec spec = gateway.specs().getSpec(symbol);
                System.out.println("  " + spec + (gateway.specs().isDegraded(symbol) ? " [built-in default]" : ""));
            } catch (ExchangeException e) {
                System.out.println("  " + symbol + ": " + e.describe());
            }
        }
    }
}
