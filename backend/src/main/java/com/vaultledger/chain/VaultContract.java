package com.vaultledger.chain;

/**
 * Function selectors and event topics of the collateral vault, the asset registry and ERC-20 tokens.
 * positionId is the first indexed parameter of every vault event.
 */
public final class VaultContract {

    private VaultContract() {
    }

    // ERC-20
    public static final String APPROVE = "0x095ea7b3";
    public static final String TRANSFER = "0xa9059cbb";
    /** Transfer(address indexed from, address indexed to, uint256 value) */
    public static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    // Vault functions
    /** depositCollateral(address token, uint256 amount, uint256 tokenValueUSD, uint8 tokenType, bool issueOAID) */
    public static final String DEPOSIT_COLLATERAL = "0x0bae9ef9";
    /** borrowUSDC(uint256 positionId, uint256 amount, uint256 loanDuration, uint256 numberOfInstallments) */
    public static final String BORROW_USDC = "0x4d111a05";
    /** repayLoan(uint256 positionId, uint256 amount) */
    public static final String REPAY_LOAN = "0x8a700b53";
    /** withdrawCollateral(uint256 positionId, uint256 amount) */
    public static final String WITHDRAW_COLLATERAL = "0x767a7b05";
    /** liquidatePosition(uint256 positionId, bytes32 marketplaceListingId) */
    public static final String LIQUIDATE_POSITION = "0x36b25469";
    /** getPosition(uint256) returns (user, token, amount, borrowed, tokenValueUSD, createdAt, active, tokenType) */
    public static final String GET_POSITION = "0xeb02c301";
    /** getOutstandingDebt(uint256) returns (uint256) */
    public static final String GET_OUTSTANDING_DEBT = "0xd5595157";

    // Vault events
    /** PositionCreated(uint256 indexed positionId, address indexed user, address collateralToken, uint256 collateralAmount, uint256 tokenValueUSD, uint8 tokenType) */
    public static final String POSITION_CREATED = "0x93cb2591720fa23e5a51a39bf9d35b6a4e5cb6c11beae435c41e4482f3a30d21";
    /** USDCBorrowed(uint256 indexed positionId, uint256 amount, uint256 totalDebt) */
    public static final String USDC_BORROWED = "0x0902160bbfee2201aa09b6b057b6f0b7d0f633b2bdefc04e987882df4aefd29c";
    /** LoanRepaid(uint256 indexed positionId, uint256 amountPaid, uint256 principal, uint256 interest, uint256 remainingDebt) */
    public static final String LOAN_REPAID = "0x91f28e20f26321cf8a71cadbefe77cfe670ee70b71a621e3ce3fb1b57e19dfaa";
    /** CollateralWithdrawn(uint256 indexed positionId, uint256 amount, uint256 remainingCollateral) */
    public static final String COLLATERAL_WITHDRAWN = "0x052c154ce87734f8e070408a78a06df4763acecd745bb76d605a1bcd391a3be7";
    /** RepaymentPlanCreated(uint256 indexed positionId, uint256 loanDuration, uint256 numberOfInstallments, uint256 installmentInterval) */
    public static final String REPAYMENT_PLAN_CREATED = "0x24350d51357e9bfd17b45613bd7e3e910b92e74f5f2e8f2345758ccf74cd4823";
    /** MissedPaymentMarked(uint256 indexed positionId, uint256 missedPayments) */
    public static final String MISSED_PAYMENT_MARKED = "0xa4e6bdb946caa62acb20ceaaa9f9978dfbf773a0d764e6232b858bdb0920bfca";
    /** PositionDefaulted(uint256 indexed positionId) */
    public static final String POSITION_DEFAULTED = "0x5493e4917872c4150c892f2053db5bf546da11d77af31efaad0d13d956f56336";
    /** PositionLiquidated(uint256 indexed positionId, bytes32 marketplaceListingId, uint256 debtAmount) */
    public static final String POSITION_LIQUIDATED = "0xd714fe40fd30678cf8f6452cd39e9af484e22fdc29c70356dc729320e5ba5f84";
    /** LiquidationSettled(uint256 indexed positionId, uint256 yieldReceived, uint256 debtRepaid, uint256 userRefund) */
    public static final String LIQUIDATION_SETTLED = "0xc62a922359b4069e608a4eae101cc36d9a64576f8460115f0a095d7231324dfc";

    // Registry events
    /** AssetRegistered(bytes32 indexed assetId, bytes32 attestationHash, address attestor) */
    public static final String ASSET_REGISTERED = "0xc8645fafb17631384ca05787ecd45bc15928250b44701b4943a78d7f778a9b97";
    /** TokenSuiteDeployed(bytes32 indexed assetId, address tokenAddress, address complianceAddress, uint256 totalSupply) */
    public static final String TOKEN_SUITE_DEPLOYED = "0xc18d6775055c0c790e1ab3ef353cbaa7ef775f7fc0bb1a89fcedfb23efe76255";
}
