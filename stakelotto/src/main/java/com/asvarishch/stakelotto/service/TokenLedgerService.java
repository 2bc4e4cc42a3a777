package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.Account;
import com.asvarishch.stakelotto.model.Allowance;
import com.asvarishch.stakelotto.model.LedgerState;
import com.asvarishch.stakelotto.repository.AccountRepository;
import com.asvarishch.stakelotto.repository.AllowanceRepository;
import com.asvarishch.stakelotto.repository.LedgerStateRepository;
import com.asvarishch.stakelotto.strategy.StakingWeightStrategy;
import com.asvarishch.stakelotto.util.Addresses;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Exclusive owner of token balances, stakes, allowances and the global supply counters.
 * <p>
 * An account's {@code balance} includes its staked capital. Staked capital is locked:
 * ordinary transfers, burns and wagers may only spend {@code balance - stakedAmount}.
 * Addresses flagged as authorised transferors may move locked capital; the stake is then
 * cut down to what remains.
 * <p>
 * Public mutators run inside {@link CallGuard}. {@link #transferInternal} is the narrow
 * interface for the round engine, gift distributor and admin gateway, which already hold the guard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLedgerService {

    private final AccountRepository accountRepository;
    private final AllowanceRepository allowanceRepository;
    private final LedgerStateRepository ledgerStateRepository;
    private final AccessControlService accessControl;
    private final StakingWeightStrategy stakingWeightStrategy;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    @Transactional
    public void initialize() {
        if (ledgerStateRepository.findById(LedgerState.SINGLETON_ID).isEmpty()) {
            ledgerStateRepository.save(LedgerState.initial());
            log.info("[LEDGER] Initialized ledger state");
        }
    }

    // ------------------------------------------------------------------
    // Supply
    // ------------------------------------------------------------------

    @Transactional
    public void mint(String caller, String to, BigDecimal amount) {
        callGuard.run("mint", () -> {
            accessControl.requireRole(caller, Role.OWNER);
            Addresses.require(to);
            final BigDecimal value = requirePositive(amount);

            final LedgerState state = ledgerState();
            final BigDecimal newSupply = TokenMath.add(state.getTotalSupply(), value);
            if (newSupply.compareTo(properties.getToken().getMaxSupply()) > 0) {
                throw LotteryException.exceedsMaxSupply(newSupply, properties.getToken().getMaxSupply());
            }

            final Account account = loadOrCreate(to);
            account.setBalance(TokenMath.add(account.getBalance(), value));
            state.setTotalSupply(newSupply);
            accountRepository.save(account);
            ledgerStateRepository.save(state);

            log.info("[LEDGER] Minted amount={} to={} totalSupply={}", value, to, newSupply);
        });
    }

    // ------------------------------------------------------------------
    // Staking
    // ------------------------------------------------------------------

    /**
     * Locks {@code amount} of the account's available balance as stake and restarts its
     * staking clock.
     */
    @Transactional
    public Account stake(String address, BigDecimal amount) {
        return callGuard.call("stake", () -> {
            Addresses.require(address);
            final BigDecimal value = requirePositive(amount);
            final BigDecimal minStake = properties.getToken().getMinStake();
            if (value.compareTo(minStake) < 0) {
                throw LotteryException.belowMinimum(value, minStake);
            }

            final Account account = loadOrCreate(address);
            final BigDecimal available = account.getAvailableBalance();
            if (available.compareTo(value) < 0) {
                throw LotteryException.insufficientBalance(address, available, value);
            }
            final BigDecimal newStaked = TokenMath.add(account.getStakedAmount(), value);
            final BigDecimal maxStake = properties.getToken().getMaxStakePerUser();
            if (newStaked.compareTo(maxStake) > 0) {
                throw LotteryException.exceedsMaximum(newStaked, maxStake);
            }

            final Instant now = clock.instant();
            final LedgerState state = ledgerState();
            account.setStakedAmount(newStaked);
            account.setStakingStartedAt(now);
            state.setTotalStaked(TokenMath.add(state.getTotalStaked(), value));
            accountRepository.save(account);
            ledgerStateRepository.save(state);

            log.info("[LEDGER] Staked address={}, amount={}, staked={}, since={}", address, value, newStaked, now);
            return account;
        });
    }

    @Transactional
    public Account unstake(String address, BigDecimal amount) {
        return callGuard.call("unstake", () -> {
            Addresses.require(address);
            final BigDecimal value = requirePositive(amount);
            final Account account = loadOrCreate(address);
            if (value.compareTo(account.getStakedAmount()) > 0) {
                throw LotteryException.insufficientStaked(address, account.getStakedAmount(), value);
            }

            final LedgerState state = ledgerState();
            final Instant now = clock.instant();
            if (!state.isEmergencyMode() && !stakingDurationMet(account, now)) {
                throw LotteryException.durationNotMet(address, String.valueOf(unlockTime(account)));
            }

            releaseStake(account, state, value);
            accountRepository.save(account);
            ledgerStateRepository.save(state);

            log.info("[LEDGER] Unstaked address={}, amount={}, remainingStaked={}", address, value, account.getStakedAmount());
            return account;
        });
    }

    /** Unstakes everything at once. Only while emergency mode is on. */
    @Transactional
    public BigDecimal emergencyUnstake(String address) {
        return callGuard.call("emergencyUnstake", () -> {
            Addresses.require(address);
            final LedgerState state = ledgerState();
            if (!state.isEmergencyMode()) {
                throw LotteryException.emergencyModeDisabled();
            }
            final Account account = loadOrCreate(address);
            final BigDecimal staked = account.getStakedAmount();
            if (staked.signum() == 0) {
                throw LotteryException.insufficientStaked(address, staked, staked);
            }

            releaseStake(account, state, staked);
            accountRepository.save(account);
            ledgerStateRepository.save(state);

            log.warn("[LEDGER] Emergency unstake address={}, amount={}", address, staked);
            return staked;
        });
    }

    // ------------------------------------------------------------------
    // Burning
    // ------------------------------------------------------------------

    @Transactional
    public void burn(String address, BigDecimal amount) {
        callGuard.run("burn", () -> {
            Addresses.require(address);
            final BigDecimal value = requirePositive(amount);
            final Account account = loadOrCreate(address);
            requireSpendable(account, value, false);
            burnFrom(account, value);
        });
    }

    /**
     * Burn on behalf of {@code address}. The caller must be an authorised burner; unless it is
     * also an authorised transferor it spends an allowance granted by {@code address}.
     */
    @Transactional
    public void authorizedBurnFrom(String caller, String address, BigDecimal amount) {
        callGuard.run("authorizedBurnFrom", () -> {
            final Account burner = accountRepository.findById(caller == null ? "" : caller).orElse(null);
            if (burner == null || !burner.isAuthorizedBurner()) {
                throw LotteryException.unauthorized(caller, "AUTHORIZED_BURNER");
            }
            Addresses.require(address);
            final BigDecimal value = requirePositive(amount);
            final Account account = loadOrCreate(address);
            final boolean privileged = burner.isAuthorizedTransferor();

            requireSpendable(account, value, privileged);
            if (!privileged) {
                consumeAllowance(address, caller, value);
            }
            burnFrom(account, value);
        });
    }

    // ------------------------------------------------------------------
    // Transfers and allowances
    // ------------------------------------------------------------------

    @Transactional
    public void transfer(String from, String to, BigDecimal amount) {
        callGuard.run("transfer", () -> {
            Addresses.require(from);
            Addresses.require(to);
            final BigDecimal value = requirePositive(amount);
            final Account sender = loadOrCreate(from);
            moveFunds(sender, to, value, sender.isAuthorizedTransferor());
        });
    }

    @Transactional
    public void transferFrom(String spender, String from, String to, BigDecimal amount) {
        callGuard.run("transferFrom", () -> {
            Addresses.require(spender);
            Addresses.require(from);
            Addresses.require(to);
            final BigDecimal value = requirePositive(amount);
            final boolean privileged = accountRepository.findById(spender)
                    .map(Account::isAuthorizedTransferor)
                    .orElse(false);

            final Account sender = loadOrCreate(from);
            requireSpendable(sender, value, privileged);
            if (!privileged) {
                consumeAllowance(from, spender, value);
            }
            moveFunds(sender, to, value, privileged);
        });
    }

    @Transactional
    public void approve(String owner, String spender, BigDecimal amount) {
        callGuard.run("approve", () -> {
            Addresses.require(owner);
            Addresses.require(spender);
            final BigDecimal value = TokenMath.normalize(amount);
            final Allowance allowance = allowanceRepository.findByOwnerAndSpender(owner, spender)
                    .orElseGet(() -> Allowance.builder().owner(owner).spender(spender).build());
            allowance.setAmount(value);
            allowanceRepository.save(allowance);
            log.info("[LEDGER] Approved owner={}, spender={}, amount={}", owner, spender, value);
        });
    }

    /**
     * Moves available funds between accounts on behalf of a component that already runs
     * inside a guarded call (wager collection, winnings, gifts, reserve funding, withdrawals).
     */
    @Transactional
    public void transferInternal(String from, String to, BigDecimal amount) {
        final BigDecimal value = requirePositive(amount);
        moveFunds(loadOrCreate(from), to, value, false);
    }

    // ------------------------------------------------------------------
    // Owner controls
    // ------------------------------------------------------------------

    @Transactional
    public void setEmergencyMode(String caller, boolean enabled) {
        callGuard.run("setEmergencyMode", () -> {
            accessControl.requireRole(caller, Role.OWNER);
            final LedgerState state = ledgerState();
            state.setEmergencyMode(enabled);
            ledgerStateRepository.save(state);
            log.warn("[LEDGER] Emergency mode set to {} by {}", enabled, caller);
        });
    }

    @Transactional
    public void setAuthorizedBurner(String caller, String address, boolean authorized) {
        callGuard.run("setAuthorizedBurner", () -> {
            accessControl.requireRole(caller, Role.OWNER);
            final Account account = loadOrCreate(Addresses.require(address));
            account.setAuthorizedBurner(authorized);
            accountRepository.save(account);
            log.info("[LEDGER] authorizedBurner={} for {} by {}", authorized, address, caller);
        });
    }

    @Transactional
    public void setAuthorizedTransferor(String caller, String address, boolean authorized) {
        callGuard.run("setAuthorizedTransferor", () -> {
            accessControl.requireRole(caller, Role.OWNER);
            final Account account = loadOrCreate(Addresses.require(address));
            account.setAuthorizedTransferor(authorized);
            accountRepository.save(account);
            log.info("[LEDGER] authorizedTransferor={} for {} by {}", authorized, address, caller);
        });
    }

    // ------------------------------------------------------------------
    // Views
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(String address) {
        return address == null ? Optional.empty() : accountRepository.findById(address);
    }

    @Transactional(readOnly = true)
    public BigDecimal balanceOf(String address) {
        return findAccount(address).map(Account::getBalance).orElse(TokenMath.ZERO);
    }

    @Transactional(readOnly = true)
    public BigDecimal availableBalanceOf(String address) {
        return findAccount(address).map(Account::getAvailableBalance).orElse(TokenMath.ZERO);
    }

    @Transactional(readOnly = true)
    public BigDecimal stakedOf(String address) {
        return findAccount(address).map(Account::getStakedAmount).orElse(TokenMath.ZERO);
    }

    @Transactional(readOnly = true)
    public BigDecimal allowance(String owner, String spender) {
        return allowanceRepository.findByOwnerAndSpender(owner, spender)
                .map(Allowance::getAmount)
                .orElse(TokenMath.ZERO);
    }

    /** Staked amount boosted by staking duration, see {@link StakingWeightStrategy}. */
    @Transactional(readOnly = true)
    public BigDecimal stakingWeight(String address) {
        return findAccount(address)
                .map(a -> stakingWeightStrategy.computeWeight(a.getStakedAmount(), a.getStakingStartedAt(), clock.instant()))
                .orElse(TokenMath.ZERO);
    }

    /** staked >= MIN_STAKE and the minimum duration met (or emergency mode). */
    @Transactional(readOnly = true)
    public boolean isEligibleForBenefits(String address) {
        final Optional<Account> account = findAccount(address);
        if (account.isEmpty()) {
            return false;
        }
        if (account.get().getStakedAmount().compareTo(properties.getToken().getMinStake()) < 0) {
            return false;
        }
        return isEmergencyMode() || stakingDurationMet(account.get(), clock.instant());
    }

    @Transactional(readOnly = true)
    public boolean isEmergencyMode() {
        return ledgerStateRepository.findById(LedgerState.SINGLETON_ID)
                .map(LedgerState::isEmergencyMode)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public LedgerState ledgerSnapshot() {
        return ledgerStateRepository.findById(LedgerState.SINGLETON_ID).orElseGet(LedgerState::initial);
    }

    // ------------------------------------------------------------------
    // internals
    // ------------------------------------------------------------------

    private void moveFunds(Account sender, String to, BigDecimal value, boolean mayMoveStaked) {
        requireSpendable(sender, value, mayMoveStaked);
        if (sender.getAddress().equals(to)) {
            // Balance is unchanged, so the stake must be too.
            log.debug("[LEDGER] Self-transfer of {} by {} left balances untouched", value, to);
            return;
        }
        final Account receiver = loadOrCreate(to);

        sender.setBalance(TokenMath.subtract(sender.getBalance(), value));
        if (sender.getStakedAmount().compareTo(sender.getBalance()) > 0) {
            final LedgerState state = ledgerState();
            releaseStake(sender, state, TokenMath.subtract(sender.getStakedAmount(), sender.getBalance()));
            ledgerStateRepository.save(state);
            log.warn("[LEDGER] Privileged transfer moved staked capital of {}; stake reduced to {}",
                    sender.getAddress(), sender.getStakedAmount());
        }
        receiver.setBalance(TokenMath.add(receiver.getBalance(), value));

        accountRepository.save(sender);
        accountRepository.save(receiver);
        log.debug("[LEDGER] Transfer from={} to={} amount={}", sender.getAddress(), to, value);
    }

    private void burnFrom(Account account, BigDecimal value) {
        final LedgerState state = ledgerState();
        account.setBalance(TokenMath.subtract(account.getBalance(), value));
        if (account.getStakedAmount().compareTo(account.getBalance()) > 0) {
            releaseStake(account, state, TokenMath.subtract(account.getStakedAmount(), account.getBalance()));
        }
        state.setTotalSupply(TokenMath.subtract(state.getTotalSupply(), value));
        state.setTotalBurned(TokenMath.add(state.getTotalBurned(), value));
        accountRepository.save(account);
        ledgerStateRepository.save(state);
        log.info("[LEDGER] Burned address={}, amount={}, totalBurned={}", account.getAddress(), value, state.getTotalBurned());
    }

    private void requireSpendable(Account account, BigDecimal value, boolean mayMoveStaked) {
        if (account.getBalance().compareTo(value) < 0) {
            throw LotteryException.insufficientBalance(account.getAddress(), account.getBalance(), value);
        }
        if (!mayMoveStaked && account.getAvailableBalance().compareTo(value) < 0) {
            throw LotteryException.insufficientTransferable(account.getAddress(), account.getAvailableBalance(), value);
        }
    }

    private void consumeAllowance(String owner, String spender, BigDecimal value) {
        final Allowance allowance = allowanceRepository.findByOwnerAndSpender(owner, spender).orElse(null);
        final BigDecimal current = allowance == null ? TokenMath.ZERO : allowance.getAmount();
        if (current.compareTo(value) < 0) {
            throw LotteryException.insufficientAllowance(owner, spender, current, value);
        }
        allowance.setAmount(TokenMath.subtract(current, value));
        allowanceRepository.save(allowance);
    }

    private void releaseStake(Account account, LedgerState state, BigDecimal value) {
        account.setStakedAmount(TokenMath.subtract(account.getStakedAmount(), value));
        state.setTotalStaked(TokenMath.subtract(state.getTotalStaked(), value));
    }

    private boolean stakingDurationMet(Account account, Instant now) {
        final Instant unlock = unlockTime(account);
        return unlock != null && !now.isBefore(unlock);
    }

    private Instant unlockTime(Account account) {
        return account.getStakingStartedAt() == null
                ? null
                : account.getStakingStartedAt().plus(properties.getToken().getMinStakeDuration());
    }

    private Account loadOrCreate(String address) {
        return accountRepository.findById(address).orElseGet(() -> Account.empty(address));
    }

    private LedgerState ledgerState() {
        return ledgerStateRepository.findById(LedgerState.SINGLETON_ID)
                .orElseGet(() -> ledgerStateRepository.save(LedgerState.initial()));
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            throw LotteryException.zeroAmount();
        }
        return TokenMath.normalize(amount);
    }
}
