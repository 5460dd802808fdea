package lending.settlement.sim.fakechain;

import lending.settlement.adapter.HotWalletGateway;
import lending.settlement.adapter.TransferRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RequiredArgsConstructor
@Slf4j
public class SimulatedHotWalletGateway implements HotWalletGateway {

    private final FakeChain fakeChain;

    @Override
    public boolean supports(String blockchainKey) {
        return fakeChain.networks().contains(blockchainKey);
    }

    @Override
    public String getAddress(String blockchainKey) {
        return fakeChain.hotWalletAddress(blockchainKey);
    }

    @Override
    public TransferResult transfer(TransferCommand command) {
        FakeChain.NextOutcome outcome = fakeChain.consumeOutcome(command.withdrawalId());
        log.info(
                "event=sim_hot_wallet.transfer withdrawalId={} blockchainKey={} tokenId={} amount={} outcome={}",
                command.withdrawalId(),
                command.blockchainKey(),
                command.tokenId(),
                command.amount(),
                outcome
        );
        return switch (outcome) {
            case SUCCESS -> new TransferResult(fakeChain.submit(command.blockchainKey(), command.withdrawalId()));
            case REJECTED -> throw new TransferRejectedException("fake node rejected transaction: nonce too low");
            case INSUFFICIENT_FUNDS -> throw new TransferRejectedException("insufficient funds for gas * price + value");
        };
    }
}
