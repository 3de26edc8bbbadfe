package com.fincraft.etl.table;

import com.fincraft.etl.model.EntityKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in table descriptors. Adding a table means adding a descriptor here, never a new extractor class.
 */
public final class TableRegistry {
    public static final String BALANCE_SHEET = "balance_sheet";
    public static final String INCOME_STATEMENT = "income_statement";
    public static final String CASH_FLOW = "cash_flow";
    public static final String TIME_SERIES_DAILY_ADJUSTED = "time_series_daily_adjusted";
    public static final String ECONOMIC_INDICATORS = "economic_indicators";

    private static final List<String> METADATA_FIELDS = List.of(
            "created_at",
            "updated_at",
            "fetched_at",
            "source_run_id",
            "landing_id",
            "api_response_status",
            "Meta Data"
    );

    private final Map<String, TableDescriptor> descriptors;

    public TableRegistry(List<TableDescriptor> descriptors) {
        Map<String, TableDescriptor> byName = new LinkedHashMap<>();
        for (TableDescriptor descriptor : descriptors) {
            byName.put(descriptor.getTableName(), descriptor);
        }
        this.descriptors = Collections.unmodifiableMap(byName);
    }

    public static TableRegistry builtIn() {
        List<TableDescriptor> out = new ArrayList<>();
        out.add(statement(BALANCE_SHEET, "BALANCE_SHEET", balanceSheetFields()));
        out.add(statement(INCOME_STATEMENT, "INCOME_STATEMENT", incomeStatementFields()));
        out.add(statement(CASH_FLOW, "CASH_FLOW", cashFlowFields()));
        out.add(TableDescriptor.builder()
                .tableName(TIME_SERIES_DAILY_ADJUSTED)
                .apiFunction("TIME_SERIES_DAILY_ADJUSTED")
                .entityKind(EntityKind.SYMBOL)
                .assetType("Stock")
                .assetType("ETF")
                .screened(true)
                .layout(PayloadLayout.PERIOD_KEYED)
                .containerKey("Time Series (Daily)")
                .fixedReportType("daily")
                .field(FieldSpec.number("open", "1. open"))
                .field(FieldSpec.number("high", "2. high"))
                .field(FieldSpec.number("low", "3. low"))
                .field(FieldSpec.number("close", "4. close"))
                .field(FieldSpec.number("adjusted_close", "5. adjusted close"))
                .field(FieldSpec.number("volume", "6. volume"))
                .field(FieldSpec.number("dividend_amount", "7. dividend amount"))
                .field(FieldSpec.number("split_coefficient", "8. split coefficient"))
                .excludedFields(METADATA_FIELDS)
                .lagRule(ReportingLagRule.daily(0))
                .requestParam("outputsize", "compact")
                .build());
        out.add(TableDescriptor.builder()
                .tableName(ECONOMIC_INDICATORS)
                .entityKind(EntityKind.INDICATOR)
                .layout(PayloadLayout.SERIES_ARRAY)
                .containerKey("data")
                .periodField("date")
                .field(FieldSpec.number("value", "value"))
                .field(FieldSpec.text("unit", "unit"))
                .excludedFields(METADATA_FIELDS)
                .lagRule(ReportingLagRule.none())
                .build());
        return new TableRegistry(out);
    }

    public Optional<TableDescriptor> find(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(tableName.trim().toLowerCase(Locale.ROOT)));
    }

    public TableDescriptor require(String tableName) {
        return find(tableName).orElseThrow(() -> new IllegalArgumentException(
                "unknown table: " + tableName + " (known: " + String.join(",", descriptors.keySet()) + ")"));
    }

    public List<String> tableNames() {
        return new ArrayList<>(descriptors.keySet());
    }

    public List<TableDescriptor> all() {
        return new ArrayList<>(descriptors.values());
    }

    private static TableDescriptor statement(String tableName, String function, List<FieldSpec> fields) {
        return TableDescriptor.builder()
                .tableName(tableName)
                .apiFunction(function)
                .entityKind(EntityKind.SYMBOL)
                .assetType("Stock")
                .screened(true)
                .layout(PayloadLayout.REPORT_SECTIONS)
                .section("quarterlyReports", "quarterly")
                .section("annualReports", "annual")
                .periodField("fiscalDateEnding")
                .field(FieldSpec.text("reported_currency", "reportedCurrency"))
                .fields(fields)
                .excludedFields(METADATA_FIELDS)
                .lagRule(ReportingLagRule.quarterly(45))
                .build();
    }

    private static List<FieldSpec> balanceSheetFields() {
        return List.of(
                FieldSpec.number("total_assets", "totalAssets"),
                FieldSpec.number("total_current_assets", "totalCurrentAssets"),
                FieldSpec.number("cash_and_cash_equivalents_at_carrying_value", "cashAndCashEquivalentsAtCarryingValue"),
                FieldSpec.number("cash_and_short_term_investments", "cashAndShortTermInvestments"),
                FieldSpec.number("inventory", "inventory"),
                FieldSpec.number("current_net_receivables", "currentNetReceivables"),
                FieldSpec.number("total_non_current_assets", "totalNonCurrentAssets"),
                FieldSpec.number("property_plant_equipment", "propertyPlantEquipment"),
                FieldSpec.number("accumulated_depreciation_amortization_ppe", "accumulatedDepreciationAmortizationPPE"),
                FieldSpec.number("intangible_assets", "intangibleAssets"),
                FieldSpec.number("intangible_assets_excluding_goodwill", "intangibleAssetsExcludingGoodwill"),
                FieldSpec.number("goodwill", "goodwill"),
                FieldSpec.number("investments", "investments"),
                FieldSpec.number("long_term_investments", "longTermInvestments"),
                FieldSpec.number("short_term_investments", "shortTermInvestments"),
                FieldSpec.number("other_current_assets", "otherCurrentAssets"),
                FieldSpec.number("other_non_current_assets", "otherNonCurrentAssets"),
                FieldSpec.number("total_liabilities", "totalLiabilities"),
                FieldSpec.number("total_current_liabilities", "totalCurrentLiabilities"),
                FieldSpec.number("current_accounts_payable", "currentAccountsPayable"),
                FieldSpec.number("deferred_revenue", "deferredRevenue"),
                FieldSpec.number("current_debt", "currentDebt"),
                FieldSpec.number("short_term_debt", "shortTermDebt"),
                FieldSpec.number("total_non_current_liabilities", "totalNonCurrentLiabilities"),
                FieldSpec.number("capital_lease_obligations", "capitalLeaseObligations"),
                FieldSpec.number("long_term_debt", "longTermDebt"),
                FieldSpec.number("current_long_term_debt", "currentLongTermDebt"),
                FieldSpec.number("long_term_debt_noncurrent", "longTermDebtNoncurrent"),
                FieldSpec.number("short_long_term_debt_total", "shortLongTermDebtTotal"),
                FieldSpec.number("other_current_liabilities", "otherCurrentLiabilities"),
                FieldSpec.number("other_non_current_liabilities", "otherNonCurrentLiabilities"),
                FieldSpec.number("total_shareholder_equity", "totalShareholderEquity"),
                FieldSpec.number("treasury_stock", "treasuryStock"),
                FieldSpec.number("retained_earnings", "retainedEarnings"),
                FieldSpec.number("common_stock", "commonStock"),
                FieldSpec.number("common_stock_shares_outstanding", "commonStockSharesOutstanding")
        );
    }

    private static List<FieldSpec> incomeStatementFields() {
        return List.of(
                FieldSpec.number("gross_profit", "grossProfit"),
                FieldSpec.number("total_revenue", "totalRevenue"),
                FieldSpec.number("cost_of_revenue", "costOfRevenue"),
                FieldSpec.number("cost_of_goods_and_services_sold", "costofGoodsAndServicesSold"),
                FieldSpec.number("operating_income", "operatingIncome"),
                FieldSpec.number("selling_general_and_administrative", "sellingGeneralAndAdministrative"),
                FieldSpec.number("research_and_development", "researchAndDevelopment"),
                FieldSpec.number("operating_expenses", "operatingExpenses"),
                FieldSpec.number("investment_income_net", "investmentIncomeNet"),
                FieldSpec.number("net_interest_income", "netInterestIncome"),
                FieldSpec.number("interest_income", "interestIncome"),
                FieldSpec.number("interest_expense", "interestExpense"),
                FieldSpec.number("non_interest_income", "nonInterestIncome"),
                FieldSpec.number("other_non_operating_income", "otherNonOperatingIncome"),
                FieldSpec.number("depreciation", "depreciation"),
                FieldSpec.number("depreciation_and_amortization", "depreciationAndAmortization"),
                FieldSpec.number("income_before_tax", "incomeBeforeTax"),
                FieldSpec.number("income_tax_expense", "incomeTaxExpense"),
                FieldSpec.number("interest_and_debt_expense", "interestAndDebtExpense"),
                FieldSpec.number("net_income_from_continuing_operations", "netIncomeFromContinuingOperations"),
                FieldSpec.number("comprehensive_income_net_of_tax", "comprehensiveIncomeNetOfTax"),
                FieldSpec.number("ebit", "ebit"),
                FieldSpec.number("ebitda", "ebitda"),
                FieldSpec.number("net_income", "netIncome")
        );
    }

    private static List<FieldSpec> cashFlowFields() {
        return List.of(
                FieldSpec.number("operating_cashflow", "operatingCashflow"),
                FieldSpec.number("payments_for_operating_activities", "paymentsForOperatingActivities"),
                FieldSpec.number("proceeds_from_operating_activities", "proceedsFromOperatingActivities"),
                FieldSpec.number("change_in_operating_liabilities", "changeInOperatingLiabilities"),
                FieldSpec.number("change_in_operating_assets", "changeInOperatingAssets"),
                FieldSpec.number("depreciation_depletion_and_amortization", "depreciationDepletionAndAmortization"),
                FieldSpec.number("capital_expenditures", "capitalExpenditures"),
                FieldSpec.number("change_in_receivables", "changeInReceivables"),
                FieldSpec.number("change_in_inventory", "changeInInventory"),
                FieldSpec.number("profit_loss", "profitLoss"),
                FieldSpec.number("cashflow_from_investment", "cashflowFromInvestment"),
                FieldSpec.number("cashflow_from_financing", "cashflowFromFinancing"),
                FieldSpec.number("proceeds_from_repayments_of_short_term_debt", "proceedsFromRepaymentsOfShortTermDebt"),
                FieldSpec.number("payments_for_repurchase_of_common_stock", "paymentsForRepurchaseOfCommonStock"),
                FieldSpec.number("payments_for_repurchase_of_equity", "paymentsForRepurchaseOfEquity"),
                FieldSpec.number("payments_for_repurchase_of_preferred_stock", "paymentsForRepurchaseOfPreferredStock"),
                FieldSpec.number("dividend_payout", "dividendPayout"),
                FieldSpec.number("dividend_payout_common_stock", "dividendPayoutCommonStock"),
                FieldSpec.number("dividend_payout_preferred_stock", "dividendPayoutPreferredStock"),
                FieldSpec.number("proceeds_from_issuance_of_common_stock", "proceedsFromIssuanceOfCommonStock"),
                FieldSpec.number("proceeds_from_issuance_of_preferred_stock", "proceedsFromIssuanceOfPreferredStock"),
                FieldSpec.number("proceeds_from_repurchase_of_equity", "proceedsFromRepurchaseOfEquity"),
                FieldSpec.number("proceeds_from_sale_of_treasury_stock", "proceedsFromSaleOfTreasuryStock"),
                FieldSpec.number("change_in_cash_and_cash_equivalents", "changeInCashAndCashEquivalents"),
                FieldSpec.number("change_in_exchange_rate", "changeInExchangeRate"),
                FieldSpec.number("net_income", "netIncome")
        );
    }
}
